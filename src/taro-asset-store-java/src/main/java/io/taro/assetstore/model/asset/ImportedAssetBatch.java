package io.taro.assetstore.model.asset;

import java.util.List;

/**
 * Database IDs produced by a batch import. Asset IDs are in the order the assets were given.
 */
public record ImportedAssetBatch(long genesisPointId, List<Long> assetIds) {

    public ImportedAssetBatch {
        assetIds = List.copyOf(assetIds);
    }
}
