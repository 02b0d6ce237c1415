package io.taro.assetstore.controller;

import io.taro.assetstore.model.asset.Asset;
import io.taro.assetstore.model.asset.ImportedAssetBatch;
import io.taro.assetstore.model.asset.OutPoint;
import io.taro.assetstore.model.asset.ScriptKey;
import io.taro.assetstore.service.AssetBatchImporter;
import io.taro.assetstore.service.InternalKeyConflictException;
import io.taro.assetstore.store.AssetStoreException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static io.taro.assetstore.TestAssets.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AssetImportController.class)
class AssetImportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AssetBatchImporter assetBatchImporter;

    @Test
    @SuppressWarnings("unchecked")
    void testImportBatch() throws Exception {
        // Given
        when(assetBatchImporter.importAssetBatch(any(), any(), any()))
                .thenReturn(new ImportedAssetBatch(3L, List.of(10L, 11L)));

        // When / Then
        mockMvc.perform(post("/api/v1/assets/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batchJson()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.genesisPointId").value(3))
                .andExpect(jsonPath("$.assetIds[0]").value(10))
                .andExpect(jsonPath("$.assetIds[1]").value(11));

        ArgumentCaptor<List<Asset>> assets = ArgumentCaptor.forClass(List.class);
        verify(assetBatchImporter).importAssetBatch(eq(GENESIS_OUT_POINT), assets.capture(), eq(List.of(4L, 5L)));
        assertEquals(2, assets.getValue().size());
        assertInstanceOf(ScriptKey.Derived.class, assets.getValue().get(0).scriptKey());
        assertInstanceOf(ScriptKey.Observed.class, assets.getValue().get(1).scriptKey());
        assertNull(assets.getValue().get(0).groupKey());
        assertEquals(pubKey(3001), assets.getValue().get(1).groupKey().groupPubKey());
    }

    @Test
    void testMalformedOutPointIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/assets/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batchJson().replace(GENESIS_OUT_POINT.toString(), "nope")))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(assetBatchImporter);
    }

    @Test
    void testEmptyBatchIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/assets/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"genesisOutPoint\":\"" + GENESIS_OUT_POINT + "\",\"assets\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testKeyConflictIsConflict() throws Exception {
        when(assetBatchImporter.importAssetBatch(any(), any(), any()))
                .thenThrow(new InternalKeyConflictException("conflict"));

        mockMvc.perform(post("/api/v1/assets/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batchJson()))
                .andExpect(status().isConflict());
    }

    @Test
    void testStoreFailureIsServerError() throws Exception {
        when(assetBatchImporter.importAssetBatch(any(OutPoint.class), any(), any()))
                .thenThrow(new AssetStoreException("upsert", "genesis point", new QueryTimeoutException("timeout")));

        mockMvc.perform(post("/api/v1/assets/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batchJson()))
                .andExpect(status().isInternalServerError());
    }

    private static String batchJson() {
        return """
                {
                  "genesisOutPoint": "%s",
                  "assets": [
                    {
                      "version": 0, "tag": "gold", "metadata": "cafe", "outputIndex": 0, "type": "NORMAL",
                      "amount": 100, "scriptVersion": 0,
                      "scriptKey": {
                        "tweakedPubKey": "%s",
                        "rawKey": {"pubKey": "%s", "family": 212, "index": 1},
                        "tweak": null
                      }
                    },
                    {
                      "version": 0, "tag": "silver", "metadata": "", "outputIndex": 1, "type": "COLLECTIBLE",
                      "amount": 1, "scriptVersion": 0, "lockTime": 500,
                      "scriptKey": {"tweakedPubKey": "%s"},
                      "groupKey": {"groupPubKey": "%s", "signature": "%s"}
                    }
                  ],
                  "anchorUtxoIds": [4, 5]
                }
                """.formatted(GENESIS_OUT_POINT, pubKey(1001), pubKey(1), pubKey(2002), pubKey(3001), signature(1));
    }
}
