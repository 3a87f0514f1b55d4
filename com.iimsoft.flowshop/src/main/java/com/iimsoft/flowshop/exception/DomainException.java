package com.iimsoft.flowshop.exception;

/** A processing time that is negative, NaN or infinite. */
public class DomainException extends FlowShopException {

    public DomainException(String component, String message) {
        super(component, message);
    }
}
