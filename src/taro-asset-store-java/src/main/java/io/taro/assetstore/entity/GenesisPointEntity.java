package io.taro.assetstore.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "genesis_points", uniqueConstraints = {
    @UniqueConstraint(name = "unique_genesis_prev_out", columnNames = {"prevOut"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenesisPointEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // encoded outpoint, see OutPointCodec
    @Column(nullable = false, length = 36)
    private byte[] prevOut;
}
