package io.taro.assetstore.service;

import io.taro.assetstore.model.asset.GroupKey;
import io.taro.assetstore.store.GroupKeyParams;
import io.taro.assetstore.store.GroupSigParams;
import io.taro.assetstore.store.UpsertAssetStore;
import io.taro.assetstore.util.KeyBytes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class GroupKeyResolver {

    private final InternalKeyResolver internalKeyResolver;

    /**
     * Store the group key of an asset and the sig linking the genesis asset to it.
     *
     * @param q              the store, bound to the caller's transaction
     * @param groupKey       the group key, null if the asset can't be reissued
     * @param genesisPointId genesis point of the batch
     * @param genAssetId     genesis asset the sig belongs to
     * @return the group sig ID, empty when there is no group key
     */
    public Optional<Long> upsertGroupKey(UpsertAssetStore q, GroupKey groupKey, long genesisPointId, long genAssetId) {
        if (groupKey == null) {
            return Optional.empty();
        }

        // Proofs don't carry the raw key, in that case the group key itself is stored as the internal key.
        long internalKeyId = groupKey.rawKey() != null
                ? internalKeyResolver.upsertInternalKey(q, groupKey.rawKey())
                : internalKeyResolver.upsertPlaceholderKey(q, groupKey.groupPubKey());

        long groupKeyId = q.upsertAssetGroupKey(GroupKeyParams.builder()
                .tweakedGroupKey(KeyBytes.fromHex("group key", groupKey.groupPubKey()))
                .internalKeyId(internalKeyId)
                .genesisPointId(genesisPointId)
                .build());

        long groupSigId = q.upsertAssetGroupSig(GroupSigParams.builder()
                .genesisSig(KeyBytes.fromHex("group sig", groupKey.signature()))
                .genAssetId(genAssetId)
                .groupKeyId(groupKeyId)
                .build());

        log.debug("Stored group key: groupKeyId={}, groupSigId={}, genAssetId={}", groupKeyId, groupSigId, genAssetId);
        return Optional.of(groupSigId);
    }
}
