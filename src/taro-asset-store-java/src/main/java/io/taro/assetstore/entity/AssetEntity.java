package io.taro.assetstore.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "assets", indexes = {
    @Index(name = "idx_assets_genesis", columnList = "genesis_id"),
    @Index(name = "idx_assets_script_key", columnList = "script_key_id"),
    @Index(name = "idx_assets_anchor_utxo", columnList = "anchorUtxoId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "genesis_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private GenesisAssetEntity genesis;

    @Column(nullable = false)
    private Integer version;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "script_key_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ScriptKeyEntity scriptKey;

    // NULL for assets that cannot be reissued
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "asset_group_sig_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private AssetGroupSigEntity groupSig;

    @Column(nullable = false)
    private Integer scriptVersion;

    @Column(nullable = false)
    private Long amount;

    private Long lockTime;

    private Long relativeLockTime;

    private Long anchorUtxoId;
}
