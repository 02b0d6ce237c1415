package io.taro.assetstore.model;

import java.util.List;

/**
 * @param genesisOutPoint outpoint shared by the batch, as {@code txid:index}
 * @param anchorUtxoIds   optional, one entry per asset
 */
public record ImportAssetBatchRequest(String genesisOutPoint,
                                      List<AssetRequest> assets,
                                      List<Long> anchorUtxoIds) {

}
