package io.taro.assetstore.service;

import io.taro.assetstore.model.asset.Asset;
import io.taro.assetstore.model.asset.Genesis;
import io.taro.assetstore.model.asset.ImportedAssetBatch;
import io.taro.assetstore.model.asset.OutPoint;
import io.taro.assetstore.store.AssetStoreTransactor;
import io.taro.assetstore.store.NewAssetParams;
import io.taro.assetstore.store.UpsertAssetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Imports assets that share a genesis outpoint, together with every row they reference.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AssetBatchImporter {

    private final AssetStoreTransactor transactor;

    private final GenesisResolver genesisResolver;

    private final GroupKeyResolver groupKeyResolver;

    private final ScriptKeyResolver scriptKeyResolver;

    /**
     * Import a batch of assets in one transaction. Either every asset is stored or none is.
     *
     * @param genesisOutPoint the outpoint shared by all assets of the batch
     * @param assets          the assets to import
     * @param anchorUtxoIds   anchor UTXO of each asset, by position. Ignored unless it has one entry per asset,
     *                        entries may be null
     * @return the genesis point ID and the asset IDs, in the order of {@code assets}
     */
    public ImportedAssetBatch importAssetBatch(OutPoint genesisOutPoint, List<Asset> assets, List<Long> anchorUtxoIds) {
        if (genesisOutPoint == null) {
            throw new IllegalArgumentException("genesis outpoint is missing");
        }
        for (Asset asset : assets) {
            if (!genesisOutPoint.equals(asset.genesis().firstPrevOut())) {
                throw new IllegalArgumentException("asset " + asset.genesis().tag()
                        + " has genesis outpoint " + asset.genesis().firstPrevOut() + ", batch is " + genesisOutPoint);
            }
        }

        boolean anchored = anchorUtxoIds != null && !anchorUtxoIds.isEmpty();
        if (anchored && anchorUtxoIds.size() != assets.size()) {
            log.warn("Got {} anchor UTXOs for {} assets, importing batch {} unanchored",
                    anchorUtxoIds.size(), assets.size(), genesisOutPoint);
            anchored = false;
        }
        List<Long> anchors = anchored ? anchorUtxoIds : null;

        log.info("Importing {} assets for genesis point {}", assets.size(), genesisOutPoint);

        try {
            ImportedAssetBatch batch = transactor.executeInTransaction(
                    q -> upsertAssetsWithGenesis(q, genesisOutPoint, assets, anchors));
            log.info("Imported batch {}: genesisPointId={}, assetIds={}",
                    genesisOutPoint, batch.genesisPointId(), batch.assetIds());
            return batch;
        } catch (RuntimeException e) {
            log.error("Import of batch {} aborted, nothing was stored", genesisOutPoint, e);
            throw e;
        }
    }

    /**
     * Rebuild the genesis of a stored genesis asset.
     */
    public Genesis fetchGenesis(long genesisId) {
        return transactor.executeReadOnly(q -> genesisResolver.fetchGenesis(q, genesisId));
    }

    private ImportedAssetBatch upsertAssetsWithGenesis(UpsertAssetStore q, OutPoint genesisOutPoint,
                                                       List<Asset> assets, List<Long> anchorUtxoIds) {
        long genesisPointId = genesisResolver.upsertGenesisPoint(q, genesisOutPoint);

        List<Long> assetIds = new ArrayList<>(assets.size());
        for (int idx = 0; idx < assets.size(); idx++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AssetImportCancelledException("import of batch " + genesisOutPoint
                        + " interrupted after " + idx + " assets");
            }

            Asset asset = assets.get(idx);

            // Dependencies first: genesis asset, group key, script key.
            long genAssetId = genesisResolver.upsertGenesisAsset(q, genesisPointId, asset.genesis());
            Long groupSigId = groupKeyResolver
                    .upsertGroupKey(q, asset.groupKey(), genesisPointId, genAssetId)
                    .orElse(null);
            long scriptKeyId = scriptKeyResolver.upsertScriptKey(q, asset.scriptKey());

            long assetId = q.insertNewAsset(NewAssetParams.builder()
                    .genesisId(genAssetId)
                    .version(asset.version())
                    .scriptKeyId(scriptKeyId)
                    .groupSigId(groupSigId)
                    .scriptVersion(asset.scriptVersion())
                    .amount(asset.amount())
                    .lockTime(asset.lockTime())
                    .relativeLockTime(asset.relativeLockTime())
                    .anchorUtxoId(anchorUtxoIds == null ? null : anchorUtxoIds.get(idx))
                    .build());
            assetIds.add(assetId);
        }

        return new ImportedAssetBatch(genesisPointId, assetIds);
    }
}
