package io.taro.assetstore.util;

/**
 * An outpoint, or stored outpoint bytes, that cannot be encoded or decoded.
 */
public class OutPointEncodingException extends RuntimeException {

    public OutPointEncodingException(String message) {
        super(message);
    }

    public OutPointEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
