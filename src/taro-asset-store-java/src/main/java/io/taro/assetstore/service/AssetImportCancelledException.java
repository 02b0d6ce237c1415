package io.taro.assetstore.service;

public class AssetImportCancelledException extends RuntimeException {

    public AssetImportCancelledException(String message) {
        super(message);
    }
}
