package io.taro.assetstore.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "genesis_assets", indexes = {
    @Index(name = "idx_genesis_assets_point", columnList = "genesis_point_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "unique_genesis_asset_id", columnNames = {"assetId"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenesisAssetEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private byte[] assetId;

    @Column(nullable = false)
    private String assetTag;

    @Column(nullable = false, length = 65536)
    private byte[] metaData;

    @Column(nullable = false)
    private Long outputIndex;

    @Column(nullable = false)
    private Short assetType;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "genesis_point_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private GenesisPointEntity genesisPoint;
}
