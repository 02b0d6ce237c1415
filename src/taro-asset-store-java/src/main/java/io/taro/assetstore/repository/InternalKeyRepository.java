package io.taro.assetstore.repository;

import io.taro.assetstore.entity.InternalKeyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface InternalKeyRepository extends JpaRepository<InternalKeyEntity, Long> {

    Optional<InternalKeyEntity> findByRawKey(byte[] rawKey);

    /**
     * Insert an internal key unless the raw key is already stored. The stored family/index are never overwritten
     *
     * @return the number of rows inserted
     */
    @Modifying
    @Query(value = "INSERT INTO internal_keys (raw_key, key_family, key_index) " +
                   "VALUES (:rawKey, :keyFamily, :keyIndex) ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIgnore(
            @Param("rawKey") byte[] rawKey,
            @Param("keyFamily") int keyFamily,
            @Param("keyIndex") int keyIndex
    );
}
