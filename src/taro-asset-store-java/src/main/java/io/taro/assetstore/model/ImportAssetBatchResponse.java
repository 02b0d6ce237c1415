package io.taro.assetstore.model;

import java.util.List;

public record ImportAssetBatchResponse(long genesisPointId, List<Long> assetIds) {

}
