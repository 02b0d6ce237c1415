package io.taro.assetstore.store;

import lombok.Builder;

@Builder
public record GroupSigParams(byte[] genesisSig, long genAssetId, long groupKeyId) {
}
