package io.matrixflow.sdk.json.spi;

import java.io.InputStream;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, etc.).
 *
 * <p>This interface avoids exposing tree model abstractions. Untyped content (such as
 * the {@code data} member of a service envelope) is read as plain maps and lists and
 * then bound with {@link #convertValue(Object, Class)}.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object, {@code null} for a JSON {@code null}
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object, {@code null} for a JSON {@code null}
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON input stream to an object of the specified type.
     * @param input JSON input stream
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(InputStream input, Class<T> type) throws JsonException;

    /**
     * Binds an already decoded value (maps, lists, scalars) to the given type.
     * @param value decoded JSON value
     * @param type target class
     * @return bound object, {@code null} if {@code value} is {@code null}
     * @throws JsonException if the value does not fit the type
     */
    <T> T convertValue(Object value, Class<T> type) throws JsonException;
}
