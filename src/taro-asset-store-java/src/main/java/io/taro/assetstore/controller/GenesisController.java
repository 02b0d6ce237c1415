package io.taro.assetstore.controller;

import io.taro.assetstore.model.GenesisResponse;
import io.taro.assetstore.service.AssetBatchImporter;
import io.taro.assetstore.service.GenesisNotFoundException;
import io.taro.assetstore.store.AssetStoreException;
import io.taro.assetstore.util.OutPointEncodingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("${apiPrefix}/genesis")
@RequiredArgsConstructor
@Slf4j
public class GenesisController {

    private final AssetBatchImporter assetBatchImporter;

    /**
     * Get the genesis of a stored genesis asset
     *
     * @param id the genesis asset ID
     * @return the genesis including its derived asset ID
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getGenesis(@PathVariable long id) {
        log.debug("GET /{} - fetching genesis", id);
        try {
            return ResponseEntity.ok(GenesisResponse.of(assetBatchImporter.fetchGenesis(id)));
        } catch (GenesisNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (OutPointEncodingException e) {
            log.warn("stored genesis {} is corrupt", id, e);
            return ResponseEntity.internalServerError().body("could not decode stored genesis point");
        } catch (AssetStoreException e) {
            log.warn("error", e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
