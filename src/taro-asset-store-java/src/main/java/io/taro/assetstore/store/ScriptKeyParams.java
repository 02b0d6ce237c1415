package io.taro.assetstore.store;

import lombok.Builder;

/**
 * @param tweak null for script keys observed in foreign proofs
 */
@Builder
public record ScriptKeyParams(long internalKeyId, byte[] tweakedScriptKey, byte[] tweak) {
}
