package com.iimsoft.flowshop.exception;

/**
 * Ragged/empty matrix, a sequence that is not a permutation of the expected jobs,
 * or a two-machine rule applied to a matrix of another width.
 */
public class DimensionException extends FlowShopException {

    public DimensionException(String component, String message) {
        super(component, message);
    }
}
