package org.luxbulb.webinfo.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * A JSON serializer that uses Jackson to serialize Java objects into single JSON documents.
 *
 * @param <T> The type of the serialized object.
 */
public class JsonSerializer<T> {
    protected final ObjectWriter _writer;

    public JsonSerializer(ObjectMapper objectMapper) {
        this(objectMapper, false);
    }

    /**
     * @param objectMapper The mapper to use.
     * @param pretty       If true, the output is indented over multiple lines.
     */
    public JsonSerializer(ObjectMapper objectMapper, boolean pretty) {
        _writer = pretty ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
    }

    public byte[] serialize(T object) {
        if (object == null)
            return null;

        try {
            return _writer.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new SerializationException(e);
        }
    }

    public String serializeToString(T object) {
        if (object == null)
            return null;

        try {
            return _writer.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new SerializationException(e);
        }
    }
}
