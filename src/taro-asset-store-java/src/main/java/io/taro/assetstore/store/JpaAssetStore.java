package io.taro.assetstore.store;

import io.taro.assetstore.entity.*;
import io.taro.assetstore.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link UpsertAssetStore} on top of the Spring Data repositories. Upserts are {@code INSERT ... ON CONFLICT DO NOTHING}
 * followed by a lookup on the natural key, so two transactions writing the same row both end up with its ID.
 * Asset rows have no natural key and are deduplicated by lookup instead.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaAssetStore implements UpsertAssetStore, FetchGenesisStore {

    private final GenesisPointRepository genesisPointRepository;

    private final GenesisAssetRepository genesisAssetRepository;

    private final InternalKeyRepository internalKeyRepository;

    private final ScriptKeyRepository scriptKeyRepository;

    private final AssetGroupKeyRepository groupKeyRepository;

    private final AssetGroupSigRepository groupSigRepository;

    private final AssetRepository assetRepository;

    @Override
    public long upsertGenesisPoint(byte[] prevOut) {
        return run("upsert", "genesis point", () -> {
            genesisPointRepository.insertIgnore(prevOut);
            return stored("genesis point", genesisPointRepository.findByPrevOut(prevOut)).getId();
        });
    }

    @Override
    public long upsertGenesisAsset(GenesisAssetParams params) {
        return run("upsert", "genesis asset", () -> {
            genesisAssetRepository.insertIgnore(params.assetId(), params.assetTag(), params.metaData(),
                    params.outputIndex(), params.assetType(), params.genesisPointId());
            return stored("genesis asset", genesisAssetRepository.findByAssetId(params.assetId())).getId();
        });
    }

    @Override
    public long upsertInternalKey(InternalKeyParams params) {
        return run("upsert", "internal key", () -> {
            internalKeyRepository.insertIgnore(params.rawKey(), params.keyFamily(), params.keyIndex());
            return stored("internal key", internalKeyRepository.findByRawKey(params.rawKey())).getId();
        });
    }

    @Override
    public Optional<InternalKeyRow> fetchInternalKey(byte[] rawKey) {
        return run("fetch", "internal key", () -> internalKeyRepository.findByRawKey(rawKey)
                .map(key -> new InternalKeyRow(key.getId(), key.getRawKey(), key.getKeyFamily(), key.getKeyIndex())));
    }

    @Override
    public Optional<Long> fetchScriptKeyIdByTweakedKey(byte[] tweakedScriptKey) {
        return run("fetch", "script key", () -> scriptKeyRepository.findIdByTweakedScriptKey(tweakedScriptKey));
    }

    @Override
    public long upsertScriptKey(ScriptKeyParams params) {
        return run("upsert", "script key", () -> {
            if (params.tweak() == null) {
                scriptKeyRepository.insertIgnoreUntweaked(params.internalKeyId(), params.tweakedScriptKey());
            } else {
                scriptKeyRepository.insertIgnore(params.internalKeyId(), params.tweakedScriptKey(), params.tweak());
            }
            return stored("script key", scriptKeyRepository.findIdByTweakedScriptKey(params.tweakedScriptKey()));
        });
    }

    @Override
    public long upsertAssetGroupKey(GroupKeyParams params) {
        return run("upsert", "group key", () -> {
            groupKeyRepository.insertIgnore(params.tweakedGroupKey(), params.internalKeyId(), params.genesisPointId());
            return stored("group key", groupKeyRepository.findByTweakedGroupKey(params.tweakedGroupKey())).getId();
        });
    }

    @Override
    public long upsertAssetGroupSig(GroupSigParams params) {
        return run("upsert", "group sig", () -> {
            groupSigRepository.insertIgnore(params.genesisSig(), params.genAssetId(), params.groupKeyId());
            return stored("group sig", groupSigRepository
                    .findByGenesisAssetAndGroupKey(params.genAssetId(), params.groupKeyId())).getId();
        });
    }

    @Override
    public long insertNewAsset(NewAssetParams params) {
        return run("insert", "asset", () -> {
            // A re-imported proof carries the same genesis, script key and anchor, so it maps onto the same row.
            var existing = assetRepository.findExisting(
                    params.genesisId(), params.scriptKeyId(), params.anchorUtxoId());
            if (!existing.isEmpty()) {
                log.debug("Asset already stored, skipping: genesisId={}, scriptKeyId={}, anchorUtxoId={}",
                        params.genesisId(), params.scriptKeyId(), params.anchorUtxoId());
                return existing.get(0).getId();
            }

            AssetEntity asset = AssetEntity.builder()
                    .genesis(genesisAssetRepository.getReferenceById(params.genesisId()))
                    .version(params.version())
                    .scriptKey(scriptKeyRepository.getReferenceById(params.scriptKeyId()))
                    .groupSig(params.groupSigId() == null
                            ? null
                            : groupSigRepository.getReferenceById(params.groupSigId()))
                    .scriptVersion(params.scriptVersion())
                    .amount(params.amount())
                    .lockTime(params.lockTime())
                    .relativeLockTime(params.relativeLockTime())
                    .anchorUtxoId(params.anchorUtxoId())
                    .build();

            return assetRepository.saveAndFlush(asset).getId();
        });
    }

    @Override
    public Optional<GenesisRow> fetchGenesisById(long genesisId) {
        return run("fetch", "genesis asset", () -> genesisAssetRepository.fetchGenesisById(genesisId));
    }

    private static <T> T stored(String entity, Optional<T> row) {
        return row.orElseThrow(() -> new EmptyResultDataAccessException(entity + " missing after upsert", 1));
    }

    private static <T> T run(String operation, String entity, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            throw new AssetStoreException(operation, entity, e);
        }
    }
}
