package io.taro.assetstore.repository;

import io.taro.assetstore.entity.ScriptKeyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ScriptKeyRepository extends JpaRepository<ScriptKeyEntity, Long> {

    Optional<ScriptKeyEntity> findByTweakedScriptKey(byte[] tweakedScriptKey);

    @Query("SELECT s.id FROM ScriptKeyEntity s WHERE s.tweakedScriptKey = :tweakedScriptKey")
    Optional<Long> findIdByTweakedScriptKey(@Param("tweakedScriptKey") byte[] tweakedScriptKey);

    /**
     * Insert a script key unless the tweaked key is already stored
     *
     * @return the number of rows inserted
     */
    @Modifying
    @Query(value = "INSERT INTO script_keys (internal_key_id, tweaked_script_key, tweak) " +
                   "VALUES (:internalKeyId, :tweakedScriptKey, :tweak) ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIgnore(
            @Param("internalKeyId") long internalKeyId,
            @Param("tweakedScriptKey") byte[] tweakedScriptKey,
            @Param("tweak") byte[] tweak
    );

    /**
     * Insert a script key without a tweak unless the tweaked key is already stored
     *
     * @return the number of rows inserted
     */
    @Modifying
    @Query(value = "INSERT INTO script_keys (internal_key_id, tweaked_script_key) " +
                   "VALUES (:internalKeyId, :tweakedScriptKey) ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIgnoreUntweaked(
            @Param("internalKeyId") long internalKeyId,
            @Param("tweakedScriptKey") byte[] tweakedScriptKey
    );
}
