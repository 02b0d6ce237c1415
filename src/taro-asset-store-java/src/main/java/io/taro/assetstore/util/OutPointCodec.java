package io.taro.assetstore.util;

import com.bloxbean.cardano.client.util.HexUtil;
import io.taro.assetstore.model.asset.OutPoint;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Wire form of an outpoint: the 32 byte tx hash followed by the output index as little-endian uint32.
 */
public final class OutPointCodec {

    public static final int ENCODED_SIZE = OutPoint.TX_HASH_SIZE + Integer.BYTES;

    private OutPointCodec() {
    }

    public static byte[] encode(OutPoint outPoint) {
        if (outPoint == null) {
            throw new OutPointEncodingException("outpoint is missing");
        }
        if (!KeyBytes.isHex(outPoint.txHash())) {
            throw new OutPointEncodingException("tx hash is not hex: " + outPoint.txHash());
        }
        byte[] txHash = HexUtil.decodeHexString(outPoint.txHash());
        return ByteBuffer.allocate(ENCODED_SIZE)
                .order(ByteOrder.LITTLE_ENDIAN)
                .put(txHash)
                .putInt((int) outPoint.outputIndex())
                .array();
    }

    public static OutPoint decode(byte[] encoded) {
        if (encoded == null || encoded.length != ENCODED_SIZE) {
            throw new OutPointEncodingException("encoded outpoint must be " + ENCODED_SIZE + " bytes, got "
                    + (encoded == null ? "null" : encoded.length));
        }
        ByteBuffer buffer = ByteBuffer.wrap(encoded).order(ByteOrder.LITTLE_ENDIAN);
        byte[] txHash = new byte[OutPoint.TX_HASH_SIZE];
        buffer.get(txHash);
        long outputIndex = Integer.toUnsignedLong(buffer.getInt());
        return new OutPoint(HexUtil.encodeHexString(txHash), outputIndex);
    }
}
