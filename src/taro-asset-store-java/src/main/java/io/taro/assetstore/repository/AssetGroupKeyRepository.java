package io.taro.assetstore.repository;

import io.taro.assetstore.entity.AssetGroupKeyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AssetGroupKeyRepository extends JpaRepository<AssetGroupKeyEntity, Long> {

    Optional<AssetGroupKeyEntity> findByTweakedGroupKey(byte[] tweakedGroupKey);

    @Modifying
    @Query(value = "INSERT INTO asset_groups (tweaked_group_key, internal_key_id, genesis_point_id) " +
                   "VALUES (:tweakedGroupKey, :internalKeyId, :genesisPointId) ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIgnore(
            @Param("tweakedGroupKey") byte[] tweakedGroupKey,
            @Param("internalKeyId") long internalKeyId,
            @Param("genesisPointId") long genesisPointId
    );
}
