package io.taro.assetstore.model.asset;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum AssetType {

    NORMAL((short) 0),

    COLLECTIBLE((short) 1);

    private final short code;

    public static AssetType fromCode(int code) {
        return Arrays.stream(values())
                .filter(type -> type.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown asset type: " + code));
    }
}
