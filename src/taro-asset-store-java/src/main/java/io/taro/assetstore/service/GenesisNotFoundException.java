package io.taro.assetstore.service;

public class GenesisNotFoundException extends RuntimeException {

    public GenesisNotFoundException(long genesisId) {
        super("genesis asset not found: " + genesisId);
    }
}
