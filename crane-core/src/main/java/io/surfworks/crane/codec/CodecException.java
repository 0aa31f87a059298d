package io.surfworks.crane.codec;

/**
 * Exception thrown when a value cannot be encoded or decoded.
 */
public class CodecException extends Exception {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
