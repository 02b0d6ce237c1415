package io.taro.assetstore.model.asset;

/**
 * A public key together with the wallet derivation path it came from.
 * Family and index are zero when the derivation path is unknown.
 */
public record KeyDescriptor(String pubKey, int family, int index) {

    public KeyDescriptor {
        if (pubKey == null || pubKey.isBlank()) {
            throw new IllegalArgumentException("public key is missing");
        }
        pubKey = pubKey.toLowerCase();
    }

    public static KeyDescriptor unknownPath(String pubKey) {
        return new KeyDescriptor(pubKey, 0, 0);
    }
}
