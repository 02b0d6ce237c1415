package io.taro.assetstore.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "script_keys", uniqueConstraints = {
    @UniqueConstraint(name = "unique_tweaked_script_key", columnNames = {"tweakedScriptKey"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScriptKeyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "internal_key_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private InternalKeyEntity internalKey;

    @Column(nullable = false, length = 33)
    private byte[] tweakedScriptKey;

    // NULL for keys observed in foreign proofs
    @Column(length = 32)
    private byte[] tweak;
}
