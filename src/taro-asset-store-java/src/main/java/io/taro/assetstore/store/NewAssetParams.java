package io.taro.assetstore.store;

import lombok.Builder;

@Builder
public record NewAssetParams(long genesisId,
                             int version,
                             long scriptKeyId,
                             Long groupSigId,
                             int scriptVersion,
                             long amount,
                             Long lockTime,
                             Long relativeLockTime,
                             Long anchorUtxoId) {
}
