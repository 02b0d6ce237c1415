package io.taro.assetstore.util;

import com.bloxbean.cardano.client.util.HexUtil;

import java.util.regex.Pattern;

/**
 * Hex to byte conversion for keys, signatures and tweaks crossing into the store.
 */
public final class KeyBytes {

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]*");

    private KeyBytes() {
    }

    public static byte[] fromHex(String field, String hex) {
        if (hex == null || hex.isEmpty()) {
            throw new IllegalArgumentException(field + " is missing");
        }
        if (!isHex(hex)) {
            throw new IllegalArgumentException(field + " is not valid hex: " + hex);
        }
        return HexUtil.decodeHexString(hex);
    }

    public static boolean isHex(String value) {
        return value != null && value.length() % 2 == 0 && HEX.matcher(value).matches();
    }

    public static byte[] fromHexOrNull(String field, String hex) {
        return hex == null ? null : fromHex(field, hex);
    }

    public static String toHex(byte[] bytes) {
        return bytes == null ? null : HexUtil.encodeHexString(bytes);
    }
}
