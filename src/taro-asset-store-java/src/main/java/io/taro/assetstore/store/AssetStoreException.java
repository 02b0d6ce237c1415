package io.taro.assetstore.store;

import lombok.Getter;

/**
 * Failure reported by the persistence layer, tagged with the operation and entity that failed.
 */
@Getter
public class AssetStoreException extends RuntimeException {

    private final String operation;

    private final String entity;

    public AssetStoreException(String operation, String entity, Throwable cause) {
        super("unable to " + operation + " " + entity + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.entity = entity;
    }
}
