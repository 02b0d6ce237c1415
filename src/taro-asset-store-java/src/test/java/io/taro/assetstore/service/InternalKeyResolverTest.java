package io.taro.assetstore.service;

import io.taro.assetstore.config.AppConfig;
import io.taro.assetstore.model.asset.KeyDescriptor;
import io.taro.assetstore.store.InMemoryAssetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.taro.assetstore.TestAssets.pubKey;
import static org.junit.jupiter.api.Assertions.*;

class InternalKeyResolverTest {

    private InMemoryAssetStore store;

    private AppConfig.Store config;

    private InternalKeyResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryAssetStore();
        config = new AppConfig.Store();
        resolver = new InternalKeyResolver(config);
    }

    @Test
    void testUpsertReturnsSameIdForSameRawKey() {
        long first = resolver.upsertInternalKey(store, new KeyDescriptor(pubKey(1), 6, 2));
        long second = resolver.upsertInternalKey(store, new KeyDescriptor(pubKey(1), 6, 2));

        assertEquals(first, second);
        assertEquals(1, store.internalKeys.size());
    }

    @Test
    void testConflictingPathKeepsFirstWrite() {
        long first = resolver.upsertInternalKey(store, new KeyDescriptor(pubKey(1), 6, 2));
        long second = resolver.upsertInternalKey(store, new KeyDescriptor(pubKey(1), 7, 9));

        assertEquals(first, second);
        var row = store.internalKey(pubKey(1));
        assertEquals(6, row.keyFamily());
        assertEquals(2, row.keyIndex());
    }

    @Test
    void testConflictingPathRejectedWhenConfigured() {
        config.setInternalKeyConflict(AppConfig.KeyConflictPolicy.REJECT);
        resolver.upsertInternalKey(store, new KeyDescriptor(pubKey(1), 6, 2));

        assertThrows(InternalKeyConflictException.class,
                () -> resolver.upsertInternalKey(store, new KeyDescriptor(pubKey(1), 6, 3)));
    }

    @Test
    void testEmptyRawKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new KeyDescriptor("", 0, 0));
    }

    @Test
    void testPlaceholderKeepsStoredPathUnderReject() {
        config.setInternalKeyConflict(AppConfig.KeyConflictPolicy.REJECT);
        long derivedId = resolver.upsertInternalKey(store, new KeyDescriptor(pubKey(1), 6, 2));

        long placeholderId = resolver.upsertPlaceholderKey(store, pubKey(1));

        assertEquals(derivedId, placeholderId);
        assertEquals(6, store.internalKey(pubKey(1)).keyFamily());
        assertEquals(2, store.internalKey(pubKey(1)).keyIndex());
    }

    @Test
    void testPlaceholderStoresUnknownPath() {
        long keyId = resolver.upsertPlaceholderKey(store, pubKey(9));

        var row = store.internalKey(pubKey(9));
        assertEquals(keyId, row.id());
        assertEquals(0, row.keyFamily());
        assertEquals(0, row.keyIndex());
    }
}
