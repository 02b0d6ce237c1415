package io.taro.assetstore.model.asset;

import lombok.Builder;

/**
 * Reissuance key of an asset.
 *
 * @param rawKey      raw key and derivation path, null when imported from a proof
 * @param groupPubKey tweaked group public key, hex
 * @param signature   serialized signature over the genesis, hex
 */
@Builder(toBuilder = true)
public record GroupKey(KeyDescriptor rawKey, String groupPubKey, String signature) {

    public GroupKey {
        if (groupPubKey == null || groupPubKey.isBlank()) {
            throw new IllegalArgumentException("group public key is missing");
        }
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("group signature is missing");
        }
        groupPubKey = groupPubKey.toLowerCase();
        signature = signature.toLowerCase();
    }
}
