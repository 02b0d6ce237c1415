package io.taro.assetstore.model.asset;

import io.taro.assetstore.util.OutPointEncodingException;

/**
 * Reference to a transaction output. The hash is kept as hex in the byte order it is serialized in.
 */
public record OutPoint(String txHash, long outputIndex) {

    public static final int TX_HASH_SIZE = 32;

    public static final long MAX_OUTPUT_INDEX = 0xFFFFFFFFL;

    public OutPoint {
        if (txHash == null || txHash.length() != TX_HASH_SIZE * 2) {
            throw new OutPointEncodingException("tx hash must be " + TX_HASH_SIZE + " bytes of hex: " + txHash);
        }
        if (outputIndex < 0 || outputIndex > MAX_OUTPUT_INDEX) {
            throw new OutPointEncodingException("output index out of range: " + outputIndex);
        }
        txHash = txHash.toLowerCase();
    }

    /**
     * Parses the {@code txid:index} form.
     */
    public static OutPoint parse(String value) {
        if (value == null) {
            throw new OutPointEncodingException("outpoint is missing");
        }
        int separator = value.lastIndexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new OutPointEncodingException("outpoint must be txid:index, got " + value);
        }
        try {
            return new OutPoint(value.substring(0, separator), Long.parseLong(value.substring(separator + 1)));
        } catch (NumberFormatException e) {
            throw new OutPointEncodingException("invalid output index in " + value, e);
        }
    }

    @Override
    public String toString() {
        return txHash + ":" + outputIndex;
    }
}
