package io.taro.assetstore.store;

import lombok.Builder;

@Builder
public record GenesisAssetParams(byte[] assetId,
                                 String assetTag,
                                 byte[] metaData,
                                 long outputIndex,
                                 short assetType,
                                 long genesisPointId) {
}
