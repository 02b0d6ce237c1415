package io.taro.assetstore.store;

/**
 * Stored genesis asset joined with its genesis point.
 */
public record GenesisRow(byte[] prevOut,
                         String assetTag,
                         byte[] metaData,
                         Long outputIndex,
                         Short assetType) {
}
