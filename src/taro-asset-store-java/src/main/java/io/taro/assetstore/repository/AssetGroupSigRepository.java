package io.taro.assetstore.repository;

import io.taro.assetstore.entity.AssetGroupSigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AssetGroupSigRepository extends JpaRepository<AssetGroupSigEntity, Long> {

    @Query("SELECT s FROM AssetGroupSigEntity s " +
           "WHERE s.genesisAsset.id = :genAssetId AND s.groupKey.id = :groupKeyId")
    Optional<AssetGroupSigEntity> findByGenesisAssetAndGroupKey(
            @Param("genAssetId") Long genAssetId,
            @Param("groupKeyId") Long groupKeyId
    );

    /**
     * Link a genesis asset to a group key unless the pair is already linked. The first signature is kept
     *
     * @return the number of rows inserted
     */
    @Modifying
    @Query(value = "INSERT INTO asset_group_sigs (genesis_sig, gen_asset_id, group_key_id) " +
                   "VALUES (:genesisSig, :genAssetId, :groupKeyId) ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIgnore(
            @Param("genesisSig") byte[] genesisSig,
            @Param("genAssetId") long genAssetId,
            @Param("groupKeyId") long groupKeyId
    );
}
