package io.taro.assetstore.model.asset;

/**
 * The key that authorizes spending an asset. Either derived by our own wallet, in which case the raw key and
 * derivation path are known, or observed in a foreign proof, in which case only the tweaked key is known.
 */
public sealed interface ScriptKey permits ScriptKey.Derived, ScriptKey.Observed {

    String tweakedPubKey();

    static Derived derived(String tweakedPubKey, KeyDescriptor rawKey, String tweak) {
        return new Derived(tweakedPubKey, rawKey, tweak);
    }

    static Observed observed(String tweakedPubKey) {
        return new Observed(tweakedPubKey);
    }

    /**
     * @param tweak hex encoded tweak, null when the key is used untweaked
     */
    record Derived(String tweakedPubKey, KeyDescriptor rawKey, String tweak) implements ScriptKey {

        public Derived {
            if (tweakedPubKey == null || tweakedPubKey.isBlank()) {
                throw new IllegalArgumentException("tweaked script key is missing");
            }
            if (rawKey == null) {
                throw new IllegalArgumentException("raw script key is missing");
            }
            tweakedPubKey = tweakedPubKey.toLowerCase();
            tweak = tweak == null ? null : tweak.toLowerCase();
        }
    }

    record Observed(String tweakedPubKey) implements ScriptKey {

        public Observed {
            if (tweakedPubKey == null || tweakedPubKey.isBlank()) {
                throw new IllegalArgumentException("tweaked script key is missing");
            }
            tweakedPubKey = tweakedPubKey.toLowerCase();
        }
    }
}
