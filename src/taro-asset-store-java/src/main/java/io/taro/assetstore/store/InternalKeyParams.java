package io.taro.assetstore.store;

import lombok.Builder;

@Builder
public record InternalKeyParams(byte[] rawKey, int keyFamily, int keyIndex) {
}
