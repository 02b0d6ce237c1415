package io.taro.assetstore.store;

public record InternalKeyRow(Long id, byte[] rawKey, Integer keyFamily, Integer keyIndex) {
}
