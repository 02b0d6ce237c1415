package io.taro.assetstore.service;

import io.taro.assetstore.config.AppConfig;
import io.taro.assetstore.model.asset.GroupKey;
import io.taro.assetstore.model.asset.KeyDescriptor;
import io.taro.assetstore.store.InMemoryAssetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static io.taro.assetstore.TestAssets.*;
import static org.junit.jupiter.api.Assertions.*;

class GroupKeyResolverTest {

    private InMemoryAssetStore store;

    private GroupKeyResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryAssetStore();
        resolver = new GroupKeyResolver(new InternalKeyResolver(new AppConfig.Store()));
    }

    @Test
    void testNoGroupKeyWritesNothing() {
        Optional<Long> groupSigId = resolver.upsertGroupKey(store, null, 1L, 1L);

        assertTrue(groupSigId.isEmpty());
        assertTrue(store.internalKeys.isEmpty());
        assertTrue(store.groupKeys.isEmpty());
        assertTrue(store.groupSigs.isEmpty());
    }

    @Test
    void testObservedGroupKeyStoresGroupKeyAsInternalKey() {
        GroupKey groupKey = groupKey(1);

        Optional<Long> groupSigId = resolver.upsertGroupKey(store, groupKey, 1L, 1L);

        assertTrue(groupSigId.isPresent());
        var internalKey = store.internalKey(groupKey.groupPubKey());
        assertNotNull(internalKey);
        assertEquals(0, internalKey.keyFamily());
        assertEquals(1, store.groupKeys.size());
        assertEquals(1, store.groupSigs.size());
    }

    @Test
    void testDerivedGroupKeyStoresRawKey() {
        GroupKey groupKey = groupKey(1).toBuilder()
                .rawKey(new KeyDescriptor(pubKey(77), 2, 5))
                .build();

        resolver.upsertGroupKey(store, groupKey, 1L, 1L);

        assertNull(store.internalKey(groupKey.groupPubKey()));
        var internalKey = store.internalKey(pubKey(77));
        assertEquals(2, internalKey.keyFamily());
        assertEquals(5, internalKey.keyIndex());
    }

    @Test
    void testOneSigPerGenesisAssetAndGroupKey() {
        GroupKey groupKey = groupKey(1);

        long first = resolver.upsertGroupKey(store, groupKey, 1L, 10L).orElseThrow();
        long again = resolver.upsertGroupKey(store, groupKey, 1L, 10L).orElseThrow();
        long reissued = resolver.upsertGroupKey(store, groupKey, 1L, 11L).orElseThrow();

        assertEquals(first, again);
        assertNotEquals(first, reissued);
        assertEquals(1, store.groupKeys.size());
        assertEquals(2, store.groupSigs.size());
    }

    @Test
    void testObservedGroupKeyMatchingDerivedKeyImportsUnderReject() {
        AppConfig.Store config = new AppConfig.Store();
        config.setInternalKeyConflict(AppConfig.KeyConflictPolicy.REJECT);
        InternalKeyResolver internalKeyResolver = new InternalKeyResolver(config);
        resolver = new GroupKeyResolver(internalKeyResolver);
        GroupKey groupKey = groupKey(1);
        internalKeyResolver.upsertInternalKey(store, new KeyDescriptor(groupKey.groupPubKey(), 3, 9));

        Optional<Long> groupSigId = resolver.upsertGroupKey(store, groupKey, 1L, 1L);

        assertTrue(groupSigId.isPresent());
        assertEquals(3, store.internalKey(groupKey.groupPubKey()).keyFamily());
        assertEquals(1, store.internalKeys.size());
    }
}
