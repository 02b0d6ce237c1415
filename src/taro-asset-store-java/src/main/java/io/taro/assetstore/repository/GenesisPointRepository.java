package io.taro.assetstore.repository;

import io.taro.assetstore.entity.GenesisPointEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GenesisPointRepository extends JpaRepository<GenesisPointEntity, Long> {

    Optional<GenesisPointEntity> findByPrevOut(byte[] prevOut);

    /**
     * Insert a genesis point unless one with the same outpoint exists
     *
     * @return the number of rows inserted
     */
    @Modifying
    @Query(value = "INSERT INTO genesis_points (prev_out) VALUES (:prevOut) ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIgnore(@Param("prevOut") byte[] prevOut);
}
