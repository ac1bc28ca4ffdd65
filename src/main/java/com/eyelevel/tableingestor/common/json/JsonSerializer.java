package com.eyelevel.tableingestor.common.json;

/**
 * Defines the contract for serializing Java objects into JSON data.
 */
public interface JsonSerializer {

    /**
     * Serializes a Java object into its JSON representation.
     *
     * @param object The Java object to serialize.
     * @param <T>    The type of the Java object.
     *
     * @return The JSON representation of the object as a string.
     *
     * @throws com.eyelevel.tableingestor.exception.json.JsonParsingException if an error occurs during
     *                                                                        JSON serialization.
     */
    <T> String serialize(T object);
}
