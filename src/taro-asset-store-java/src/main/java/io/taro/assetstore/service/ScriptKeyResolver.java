package io.taro.assetstore.service;

import io.taro.assetstore.model.asset.ScriptKey;
import io.taro.assetstore.store.ScriptKeyParams;
import io.taro.assetstore.store.UpsertAssetStore;
import io.taro.assetstore.util.KeyBytes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScriptKeyResolver {

    private final InternalKeyResolver internalKeyResolver;

    /**
     * Store a script key together with the internal key it is derived from.
     *
     * @param q         the store, bound to the caller's transaction
     * @param scriptKey wallet derived or observed script key
     * @return the script key ID
     */
    public long upsertScriptKey(UpsertAssetStore q, ScriptKey scriptKey) {
        if (scriptKey instanceof ScriptKey.Derived derived) {
            return upsertDerived(q, derived);
        }
        if (scriptKey instanceof ScriptKey.Observed observed) {
            return upsertObserved(q, observed);
        }
        throw new IllegalArgumentException("Unsupported script key: " + scriptKey);
    }

    private long upsertDerived(UpsertAssetStore q, ScriptKey.Derived scriptKey) {
        long internalKeyId = internalKeyResolver.upsertInternalKey(q, scriptKey.rawKey());

        long scriptKeyId = q.upsertScriptKey(ScriptKeyParams.builder()
                .internalKeyId(internalKeyId)
                .tweakedScriptKey(KeyBytes.fromHex("tweaked script key", scriptKey.tweakedPubKey()))
                .tweak(KeyBytes.fromHexOrNull("script key tweak", scriptKey.tweak()))
                .build());
        log.debug("Stored derived script key: id={}, internalKeyId={}", scriptKeyId, internalKeyId);
        return scriptKeyId;
    }

    private long upsertObserved(UpsertAssetStore q, ScriptKey.Observed scriptKey) {
        byte[] tweakedKey = KeyBytes.fromHex("tweaked script key", scriptKey.tweakedPubKey());

        Optional<Long> existing = q.fetchScriptKeyIdByTweakedKey(tweakedKey);
        if (existing.isPresent()) {
            log.debug("Script key already known: id={}", existing.get());
            return existing.get();
        }

        // Foreign proof: we don't hold the raw key, so the tweaked key stands in as the internal key. It can't be
        // used for signing but the asset can still be imported.
        long internalKeyId = internalKeyResolver.upsertPlaceholderKey(q, scriptKey.tweakedPubKey());

        long scriptKeyId = q.upsertScriptKey(ScriptKeyParams.builder()
                .internalKeyId(internalKeyId)
                .tweakedScriptKey(tweakedKey)
                .build());
        log.debug("Stored observed script key: id={}, placeholder internalKeyId={}", scriptKeyId, internalKeyId);
        return scriptKeyId;
    }
}
