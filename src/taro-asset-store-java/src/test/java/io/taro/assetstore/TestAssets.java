package io.taro.assetstore;

import io.taro.assetstore.model.asset.*;

/**
 * Fixture builders shared by the tests.
 */
public final class TestAssets {

    public static final OutPoint GENESIS_OUT_POINT = outPoint(1, 0);

    private TestAssets() {
    }

    public static OutPoint outPoint(int txSeed, long index) {
        return new OutPoint(String.format("%064x", txSeed), index);
    }

    /**
     * Compressed public key shaped hex, distinct per seed
     */
    public static String pubKey(int seed) {
        return "02" + String.format("%064x", seed);
    }

    public static String signature(int seed) {
        return String.format("%0128x", seed);
    }

    public static Genesis genesis(String tag, long outputIndex) {
        return Genesis.builder()
                .firstPrevOut(GENESIS_OUT_POINT)
                .tag(tag)
                .metadata("cafebabe")
                .outputIndex(outputIndex)
                .type(AssetType.NORMAL)
                .build();
    }

    public static ScriptKey.Derived derivedScriptKey(int seed, int family, int index) {
        return ScriptKey.derived(pubKey(1000 + seed), new KeyDescriptor(pubKey(seed), family, index),
                String.format("%064x", seed));
    }

    public static ScriptKey.Observed observedScriptKey(int seed) {
        return ScriptKey.observed(pubKey(2000 + seed));
    }

    public static GroupKey groupKey(int seed) {
        return GroupKey.builder()
                .groupPubKey(pubKey(3000 + seed))
                .signature(signature(seed))
                .build();
    }

    public static Asset asset(String tag, long outputIndex, ScriptKey scriptKey, GroupKey groupKey) {
        return Asset.builder()
                .version(0)
                .genesis(genesis(tag, outputIndex))
                .amount(1000L + outputIndex)
                .scriptVersion(0)
                .scriptKey(scriptKey)
                .groupKey(groupKey)
                .build();
    }
}
