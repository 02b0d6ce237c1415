package io.taro.assetstore.store;

import java.util.Optional;

/**
 * Store operations used to insert assets and everything they reference. Upserts return the primary key of the
 * existing row when the natural key is already present.
 * <p>
 * Implementations throw {@link AssetStoreException} on any persistence failure.
 */
public interface UpsertAssetStore {

    /**
     * Inserts a genesis point or returns the existing one, keyed by the encoded outpoint.
     */
    long upsertGenesisPoint(byte[] prevOut);

    /**
     * Inserts the genesis information of an asset or returns the existing row with the same asset ID.
     */
    long upsertGenesisAsset(GenesisAssetParams params);

    /**
     * Inserts an internal key or returns the existing row with the same raw key. Family and index of an existing
     * row are left untouched.
     */
    long upsertInternalKey(InternalKeyParams params);

    Optional<InternalKeyRow> fetchInternalKey(byte[] rawKey);

    /**
     * Looks up a script key by its tweaked key. Empty when the key was never stored.
     */
    Optional<Long> fetchScriptKeyIdByTweakedKey(byte[] tweakedScriptKey);

    long upsertScriptKey(ScriptKeyParams params);

    long upsertAssetGroupKey(GroupKeyParams params);

    long upsertAssetGroupSig(GroupSigParams params);

    long insertNewAsset(NewAssetParams params);
}
