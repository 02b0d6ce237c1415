package io.taro.assetstore.repository;

import io.taro.assetstore.entity.GenesisAssetEntity;
import io.taro.assetstore.store.GenesisRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GenesisAssetRepository extends JpaRepository<GenesisAssetEntity, Long> {

    Optional<GenesisAssetEntity> findByAssetId(byte[] assetId);

    /**
     * Insert a genesis asset unless one with the same asset ID exists
     *
     * @return the number of rows inserted
     */
    @Modifying
    @Query(value = "INSERT INTO genesis_assets " +
                   "(asset_id, asset_tag, meta_data, output_index, asset_type, genesis_point_id) " +
                   "VALUES (:assetId, :assetTag, :metaData, :outputIndex, :assetType, :genesisPointId) " +
                   "ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIgnore(
            @Param("assetId") byte[] assetId,
            @Param("assetTag") String assetTag,
            @Param("metaData") byte[] metaData,
            @Param("outputIndex") long outputIndex,
            @Param("assetType") short assetType,
            @Param("genesisPointId") long genesisPointId
    );

    /**
     * Fetch a genesis asset together with the outpoint of its genesis point
     */
    @Query("SELECT new io.taro.assetstore.store.GenesisRow(p.prevOut, g.assetTag, g.metaData, g.outputIndex, g.assetType) " +
           "FROM GenesisAssetEntity g JOIN g.genesisPoint p " +
           "WHERE g.id = :id")
    Optional<GenesisRow> fetchGenesisById(@Param("id") Long id);
}
