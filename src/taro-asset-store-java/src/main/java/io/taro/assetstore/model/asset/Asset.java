package io.taro.assetstore.model.asset;

import lombok.Builder;

@Builder(toBuilder = true)
public record Asset(int version,
                    Genesis genesis,
                    long amount,
                    Long lockTime,
                    Long relativeLockTime,
                    int scriptVersion,
                    ScriptKey scriptKey,
                    GroupKey groupKey) {

    public Asset {
        if (genesis == null) {
            throw new IllegalArgumentException("asset genesis is missing");
        }
        if (scriptKey == null) {
            throw new IllegalArgumentException("asset script key is missing");
        }
        if (amount < 0) {
            throw new IllegalArgumentException("asset amount must not be negative: " + amount);
        }
    }
}
