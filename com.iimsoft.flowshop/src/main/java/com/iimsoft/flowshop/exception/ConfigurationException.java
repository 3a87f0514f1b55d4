package com.iimsoft.flowshop.exception;

/** A search parameter outside its legal range; raised before any search begins. */
public class ConfigurationException extends FlowShopException {

    public ConfigurationException(String component, String message) {
        super(component, message);
    }
}
