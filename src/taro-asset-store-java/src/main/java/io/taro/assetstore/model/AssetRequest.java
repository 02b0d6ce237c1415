package io.taro.assetstore.model;

import io.taro.assetstore.model.asset.Asset;
import io.taro.assetstore.model.asset.AssetType;
import io.taro.assetstore.model.asset.Genesis;
import io.taro.assetstore.model.asset.GroupKey;
import io.taro.assetstore.model.asset.OutPoint;

public record AssetRequest(int version,
                           String tag,
                           String metadata,
                           long outputIndex,
                           AssetType type,
                           long amount,
                           Long lockTime,
                           Long relativeLockTime,
                           int scriptVersion,
                           ScriptKeyRequest scriptKey,
                           GroupKey groupKey) {

    public Asset toAsset(OutPoint genesisOutPoint) {
        if (scriptKey == null) {
            throw new IllegalArgumentException("script key is missing for asset " + tag);
        }
        return Asset.builder()
                .version(version)
                .genesis(Genesis.builder()
                        .firstPrevOut(genesisOutPoint)
                        .tag(tag)
                        .metadata(metadata)
                        .outputIndex(outputIndex)
                        .type(type)
                        .build())
                .amount(amount)
                .lockTime(lockTime)
                .relativeLockTime(relativeLockTime)
                .scriptVersion(scriptVersion)
                .scriptKey(scriptKey.toScriptKey())
                .groupKey(groupKey)
                .build();
    }
}
