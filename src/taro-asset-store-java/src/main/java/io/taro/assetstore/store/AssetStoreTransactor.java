package io.taro.assetstore.store;

import java.util.function.Function;

/**
 * Runs store work inside one atomic scope. If the work throws, nothing it wrote is kept.
 */
public interface AssetStoreTransactor {

    <T> T executeInTransaction(Function<UpsertAssetStore, T> work);

    <T> T executeReadOnly(Function<FetchGenesisStore, T> work);
}
