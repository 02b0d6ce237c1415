package io.taro.assetstore.service;

import io.taro.assetstore.model.asset.AssetType;
import io.taro.assetstore.model.asset.Genesis;
import io.taro.assetstore.model.asset.OutPoint;
import io.taro.assetstore.store.FetchGenesisStore;
import io.taro.assetstore.store.GenesisAssetParams;
import io.taro.assetstore.store.GenesisRow;
import io.taro.assetstore.store.UpsertAssetStore;
import io.taro.assetstore.util.KeyBytes;
import io.taro.assetstore.util.OutPointCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class GenesisResolver {

    /**
     * Store the outpoint that ties a batch of assets together.
     *
     * @throws io.taro.assetstore.util.OutPointEncodingException if the outpoint can't be encoded
     */
    public long upsertGenesisPoint(UpsertAssetStore q, OutPoint genesisOutPoint) {
        byte[] prevOut = OutPointCodec.encode(genesisOutPoint);

        long genesisPointId = q.upsertGenesisPoint(prevOut);
        log.debug("Stored genesis point: id={}, outpoint={}", genesisPointId, genesisOutPoint);
        return genesisPointId;
    }

    /**
     * Store the genesis information that derives the asset ID.
     */
    public long upsertGenesisAsset(UpsertAssetStore q, long genesisPointId, Genesis genesis) {
        long genAssetId = q.upsertGenesisAsset(GenesisAssetParams.builder()
                .assetId(genesis.assetId())
                .assetTag(genesis.tag())
                .metaData(genesis.metadataBytes())
                .outputIndex(genesis.outputIndex())
                .assetType(genesis.type().getCode())
                .genesisPointId(genesisPointId)
                .build());
        log.debug("Stored genesis asset: id={}, tag={}, assetId={}", genAssetId, genesis.tag(), genesis.assetIdHex());
        return genAssetId;
    }

    /**
     * Rebuild a genesis from its stored row.
     *
     * @throws GenesisNotFoundException if there is no genesis asset with that ID
     * @throws io.taro.assetstore.util.OutPointEncodingException if the stored outpoint can't be decoded
     */
    public Genesis fetchGenesis(FetchGenesisStore q, long genesisId) {
        GenesisRow row = q.fetchGenesisById(genesisId)
                .orElseThrow(() -> new GenesisNotFoundException(genesisId));

        return Genesis.builder()
                .firstPrevOut(OutPointCodec.decode(row.prevOut()))
                .tag(row.assetTag())
                .metadata(KeyBytes.toHex(row.metaData()))
                .outputIndex(row.outputIndex())
                .type(AssetType.fromCode(row.assetType()))
                .build();
    }
}
