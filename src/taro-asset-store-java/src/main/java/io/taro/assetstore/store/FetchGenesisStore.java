package io.taro.assetstore.store;

import java.util.Optional;

public interface FetchGenesisStore {

    /**
     * Fetches a genesis asset by its primary key.
     */
    Optional<GenesisRow> fetchGenesisById(long genesisId);
}
