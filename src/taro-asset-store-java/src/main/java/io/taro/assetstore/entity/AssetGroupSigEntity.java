package io.taro.assetstore.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Ties one genesis asset to the group key that may reissue it. Many sigs per group key.
 */
@Entity
@Table(name = "asset_group_sigs", indexes = {
    @Index(name = "idx_group_sigs_group_key", columnList = "group_key_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "unique_group_sig_gen_asset", columnNames = {"gen_asset_id", "group_key_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetGroupSigEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 72)
    private byte[] genesisSig;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "gen_asset_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private GenesisAssetEntity genesisAsset;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "group_key_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private AssetGroupKeyEntity groupKey;
}
