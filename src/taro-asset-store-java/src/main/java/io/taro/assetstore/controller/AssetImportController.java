package io.taro.assetstore.controller;

import io.taro.assetstore.model.ImportAssetBatchRequest;
import io.taro.assetstore.model.ImportAssetBatchResponse;
import io.taro.assetstore.model.asset.Asset;
import io.taro.assetstore.model.asset.ImportedAssetBatch;
import io.taro.assetstore.model.asset.OutPoint;
import io.taro.assetstore.service.AssetBatchImporter;
import io.taro.assetstore.service.AssetImportCancelledException;
import io.taro.assetstore.service.InternalKeyConflictException;
import io.taro.assetstore.store.AssetStoreException;
import io.taro.assetstore.util.OutPointEncodingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("${apiPrefix}/assets")
@RequiredArgsConstructor
@Slf4j
public class AssetImportController {

    private final AssetBatchImporter assetBatchImporter;

    /**
     * Import a batch of assets sharing one genesis outpoint
     *
     * @param request the genesis outpoint, the assets and optionally their anchor UTXO IDs
     * @return the genesis point ID and one asset ID per submitted asset, in order
     */
    @PostMapping("/import")
    public ResponseEntity<?> importAssets(@RequestBody ImportAssetBatchRequest request) {
        log.debug("POST /import - genesisOutPoint={}", request.genesisOutPoint());

        if (request.assets() == null || request.assets().isEmpty()) {
            return ResponseEntity.badRequest().body("no assets to import");
        }

        try {
            OutPoint genesisOutPoint = OutPoint.parse(request.genesisOutPoint());
            List<Asset> assets = request.assets().stream()
                    .map(asset -> asset.toAsset(genesisOutPoint))
                    .toList();

            ImportedAssetBatch batch = assetBatchImporter.importAssetBatch(
                    genesisOutPoint, assets, request.anchorUtxoIds());

            return ResponseEntity.ok(new ImportAssetBatchResponse(batch.genesisPointId(), batch.assetIds()));
        } catch (OutPointEncodingException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (InternalKeyConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        } catch (AssetImportCancelledException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.getMessage());
        } catch (AssetStoreException e) {
            log.warn("error", e);
            return ResponseEntity.internalServerError().body(String.format("could not %s %s", e.getOperation(), e.getEntity()));
        }
    }
}
