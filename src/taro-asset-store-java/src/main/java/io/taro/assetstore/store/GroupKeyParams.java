package io.taro.assetstore.store;

import lombok.Builder;

@Builder
public record GroupKeyParams(byte[] tweakedGroupKey, long internalKeyId, long genesisPointId) {
}
