package io.taro.assetstore.repository;

import io.taro.assetstore.entity.AssetEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AssetRepository extends JpaRepository<AssetEntity, Long> {

    /**
     * Find asset rows for the same genesis, script key and anchor, oldest first
     */
    @Query("SELECT a FROM AssetEntity a WHERE a.genesis.id = :genesisId " +
           "AND a.scriptKey.id = :scriptKeyId " +
           "AND (a.anchorUtxoId = :anchorUtxoId OR (a.anchorUtxoId IS NULL AND :anchorUtxoId IS NULL)) " +
           "ORDER BY a.id")
    List<AssetEntity> findExisting(
            @Param("genesisId") Long genesisId,
            @Param("scriptKeyId") Long scriptKeyId,
            @Param("anchorUtxoId") Long anchorUtxoId
    );
}
