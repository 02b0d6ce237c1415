package io.taro.assetstore.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "asset_groups", uniqueConstraints = {
    @UniqueConstraint(name = "unique_tweaked_group_key", columnNames = {"tweakedGroupKey"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetGroupKeyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 33)
    private byte[] tweakedGroupKey;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "internal_key_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private InternalKeyEntity internalKey;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "genesis_point_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private GenesisPointEntity genesisPoint;
}
