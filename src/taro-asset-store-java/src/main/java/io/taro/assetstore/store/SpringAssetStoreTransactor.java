package io.taro.assetstore.store;

import io.taro.assetstore.config.AppConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * Opens one Spring transaction per unit of work. The configured timeout is the deadline for the whole unit.
 */
@Component
@Slf4j
public class SpringAssetStoreTransactor implements AssetStoreTransactor {

    private final TransactionTemplate writeTemplate;

    private final TransactionTemplate readTemplate;

    private final UpsertAssetStore upsertStore;

    private final FetchGenesisStore fetchStore;

    @Autowired
    public SpringAssetStoreTransactor(PlatformTransactionManager transactionManager,
                                      JpaAssetStore store,
                                      AppConfig.Store config) {
        this(transactionManager, store, store, config);
    }

    public SpringAssetStoreTransactor(PlatformTransactionManager transactionManager,
                                      UpsertAssetStore upsertStore,
                                      FetchGenesisStore fetchStore,
                                      AppConfig.Store config) {
        this.upsertStore = upsertStore;
        this.fetchStore = fetchStore;

        int timeoutSeconds = (int) Math.max(1, config.getTxTimeout().toSeconds());

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(timeoutSeconds);

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setTimeout(timeoutSeconds);
        this.readTemplate.setReadOnly(true);
    }

    @Override
    public <T> T executeInTransaction(Function<UpsertAssetStore, T> work) {
        try {
            return writeTemplate.execute(status -> work.apply(upsertStore));
        } catch (TransactionException e) {
            log.error("asset store transaction failed", e);
            throw new AssetStoreException("commit", "asset store transaction", e);
        } catch (DataAccessException e) {
            throw new AssetStoreException("write", "asset store transaction", e);
        }
    }

    @Override
    public <T> T executeReadOnly(Function<FetchGenesisStore, T> work) {
        try {
            return readTemplate.execute(status -> work.apply(fetchStore));
        } catch (TransactionException e) {
            throw new AssetStoreException("read", "asset store transaction", e);
        }
    }
}
