package io.taro.assetstore.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "internal_keys", uniqueConstraints = {
    @UniqueConstraint(name = "unique_internal_raw_key", columnNames = {"rawKey"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InternalKeyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 33)
    private byte[] rawKey;

    // zero family and index: derivation path unknown
    @Column(nullable = false)
    private Integer keyFamily;

    @Column(nullable = false)
    private Integer keyIndex;
}
