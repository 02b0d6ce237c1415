package io.taro.assetstore.model.asset;

import com.bloxbean.cardano.client.util.HexUtil;
import io.taro.assetstore.util.Hashes;
import io.taro.assetstore.util.KeyBytes;
import io.taro.assetstore.util.OutPointCodec;
import lombok.Builder;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Immutable genesis information of an asset. Everything needed to derive the asset ID.
 *
 * @param firstPrevOut the outpoint spent by the minting transaction
 * @param tag          human readable asset tag
 * @param metadata     opaque metadata blob, hex encoded (empty string for none)
 * @param outputIndex  index of the minting output that holds the asset
 * @param type         asset type
 */
@Builder(toBuilder = true)
public record Genesis(OutPoint firstPrevOut,
                      String tag,
                      String metadata,
                      long outputIndex,
                      AssetType type) {

    public Genesis {
        if (firstPrevOut == null) {
            throw new IllegalArgumentException("genesis outpoint is missing");
        }
        if (type == null) {
            throw new IllegalArgumentException("asset type is missing");
        }
        if (outputIndex < 0 || outputIndex > OutPoint.MAX_OUTPUT_INDEX) {
            throw new IllegalArgumentException("genesis output index out of range: " + outputIndex);
        }
        tag = tag == null ? "" : tag;
        metadata = metadata == null ? "" : metadata.toLowerCase();
        if (!KeyBytes.isHex(metadata)) {
            throw new IllegalArgumentException("metadata is not valid hex: " + metadata);
        }
    }

    public byte[] metadataBytes() {
        return metadata.isEmpty() ? new byte[0] : KeyBytes.fromHex("metadata", metadata);
    }

    public byte[] tagHash() {
        return Hashes.sha256(tag.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Derives the asset ID: sha256(outpoint || sha256(tag) || metadata || outputIndex || type).
     */
    public byte[] assetId() {
        MessageDigest digest = Hashes.newSha256();
        digest.update(OutPointCodec.encode(firstPrevOut));
        digest.update(tagHash());
        digest.update(metadataBytes());
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt((int) outputIndex).array());
        digest.update((byte) type.getCode());
        return digest.digest();
    }

    public String assetIdHex() {
        return HexUtil.encodeHexString(assetId());
    }
}
