package io.surfworks.crane.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts values to and from Jackson JSON trees.
 *
 * @param <T> the value type
 */
public interface JsonCodec<T> {

    JsonNode encode(T value);

    /**
     * Decodes a value, checking every invariant of its type.
     *
     * @throws CodecException if the tree is malformed or describes an invalid value
     */
    T decode(JsonNode node) throws CodecException;
}
