package io.taro.assetstore.service;

/**
 * A raw key that is already stored was presented again with a different derivation path.
 */
public class InternalKeyConflictException extends RuntimeException {

    public InternalKeyConflictException(String message) {
        super(message);
    }
}
