package com.questrail.netconn.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.netconn.error.WireFormatException;

import java.util.Objects;

/**
 * Jackson-backed conversion between values and the JSON text carried inside a
 * wire string.
 *
 * <p>JSON null and the null string are the same thing on the wire: a null
 * value (or a {@code NullNode}) encodes to a null string, and a null string or
 * the text {@code null} decodes to {@code null}.</p>
 */
public final class JsonCodec
{
    private static final JsonCodec DEFAULT = new JsonCodec(new ObjectMapper());

    private final ObjectMapper mapper;

    public JsonCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /** Codec with a plain {@link ObjectMapper}. */
    public static JsonCodec defaultCodec()
    {
        return DEFAULT;
    }

    public ObjectMapper mapper()
    {
        return mapper;
    }

    /**
     * @return JSON text, or {@code null} for a JSON null
     */
    public String toText(Object value)
    {
        if (value == null || (value instanceof JsonNode node && node.isNull())) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized to JSON: " + value.getClass().getName(), e);
        }
    }

    /**
     * @return parsed tree, or {@code null} for a null or empty string or JSON null
     */
    public JsonNode parse(String text)
    {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(text);
            return node == null || node.isNull() || node.isMissingNode() ? null : node;
        }
        catch (JsonProcessingException e) {
            throw new WireFormatException("Received string is not valid JSON", e);
        }
    }

    public <T> T parse(String text, Class<T> type)
    {
        Objects.requireNonNull(type, "type");
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return mapper.readValue(text, type);
        }
        catch (JsonProcessingException e) {
            throw new WireFormatException("Received JSON does not map to " + type.getName(), e);
        }
    }
}
