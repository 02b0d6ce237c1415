package io.taro.assetstore.service;

import io.taro.assetstore.config.AppConfig;
import io.taro.assetstore.model.asset.KeyDescriptor;
import io.taro.assetstore.store.InternalKeyParams;
import io.taro.assetstore.store.InternalKeyRow;
import io.taro.assetstore.store.UpsertAssetStore;
import io.taro.assetstore.util.KeyBytes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class InternalKeyResolver {

    private final AppConfig.Store config;

    /**
     * Store an internal key, or return the ID of the row already holding the same raw key.
     * <p>
     * The family/index of the first write are kept. A later write with different values is logged, or rejected
     * under {@link AppConfig.KeyConflictPolicy#REJECT}.
     *
     * @param q   the store, bound to the caller's transaction
     * @param key the raw key and its derivation path
     * @return the internal key ID
     */
    public long upsertInternalKey(UpsertAssetStore q, KeyDescriptor key) {
        byte[] rawKey = KeyBytes.fromHex("raw key", key.pubKey());

        Optional<InternalKeyRow> existing = q.fetchInternalKey(rawKey);
        if (existing.isPresent()) {
            InternalKeyRow row = existing.get();
            if (row.keyFamily() != key.family() || row.keyIndex() != key.index()) {
                String message = String.format("internal key %s stored with family=%d index=%d, got family=%d index=%d",
                        key.pubKey(), row.keyFamily(), row.keyIndex(), key.family(), key.index());
                if (config.getInternalKeyConflict() == AppConfig.KeyConflictPolicy.REJECT) {
                    throw new InternalKeyConflictException(message);
                }
                log.warn("{}, keeping the stored derivation path", message);
            }
            return row.id();
        }

        return insertInternalKey(q, rawKey, key);
    }

    /**
     * Store a key seen only in a proof as its own internal key. Its derivation path is unknown, so a row already
     * holding the same key keeps its path and no conflict is reported.
     *
     * @param q      the store, bound to the caller's transaction
     * @param pubKey the tweaked key standing in for the raw key
     * @return the internal key ID
     */
    public long upsertPlaceholderKey(UpsertAssetStore q, String pubKey) {
        KeyDescriptor key = KeyDescriptor.unknownPath(pubKey);
        byte[] rawKey = KeyBytes.fromHex("raw key", key.pubKey());

        Optional<InternalKeyRow> existing = q.fetchInternalKey(rawKey);
        if (existing.isPresent()) {
            return existing.get().id();
        }
        return insertInternalKey(q, rawKey, key);
    }

    private long insertInternalKey(UpsertAssetStore q, byte[] rawKey, KeyDescriptor key) {
        long keyId = q.upsertInternalKey(InternalKeyParams.builder()
                .rawKey(rawKey)
                .keyFamily(key.family())
                .keyIndex(key.index())
                .build());
        log.debug("Stored internal key: id={}, family={}, index={}", keyId, key.family(), key.index());
        return keyId;
    }
}
