package io.taro.assetstore.model;

import io.taro.assetstore.model.asset.AssetType;
import io.taro.assetstore.model.asset.Genesis;

public record GenesisResponse(String genesisOutPoint,
                              String tag,
                              String metadata,
                              long outputIndex,
                              AssetType type,
                              String assetId) {

    public static GenesisResponse of(Genesis genesis) {
        return new GenesisResponse(genesis.firstPrevOut().toString(),
                genesis.tag(),
                genesis.metadata(),
                genesis.outputIndex(),
                genesis.type(),
                genesis.assetIdHex());
    }
}
