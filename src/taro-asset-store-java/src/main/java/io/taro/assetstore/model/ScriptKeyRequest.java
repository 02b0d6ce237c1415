package io.taro.assetstore.model;

import io.taro.assetstore.model.asset.KeyDescriptor;
import io.taro.assetstore.model.asset.ScriptKey;

/**
 * Script key as submitted over HTTP. Without a raw key the script key is treated as observed.
 */
public record ScriptKeyRequest(String tweakedPubKey,
                               KeyDescriptor rawKey,
                               String tweak) {

    public ScriptKey toScriptKey() {
        if (rawKey == null) {
            return ScriptKey.observed(tweakedPubKey);
        }
        return ScriptKey.derived(tweakedPubKey, rawKey, tweak);
    }
}
