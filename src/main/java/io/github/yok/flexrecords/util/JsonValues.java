package io.github.yok.flexrecords.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.Generated;

/**
 * Turns resolved record values into scalar bind values.
 *
 * <p>
 * Nested objects and arrays that survive reference resolution are written as JSON text, so a
 * {@code QueryRunner} only ever receives scalars.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Prevents instantiation.
     */
    @Generated
    private JsonValues() {}

    /**
     * Converts one value into a bind value.
     *
     * @param value resolved value (scalar, {@link Map} or {@link Collection})
     * @return the value itself for scalars, JSON text for containers
     * @throws IllegalArgumentException if the container cannot be serialized
     */
    public static Object toBindValue(Object value) {
        if (value instanceof Map || value instanceof Collection) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Failed to serialize value as JSON: " + value,
                        e);
            }
        }
        return value;
    }

    /**
     * Converts every value of a list into a bind value.
     *
     * @param values resolved values
     * @return bind values in the same order
     */
    public static List<Object> toBindValues(Collection<?> values) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object v : values) {
            result.add(toBindValue(v));
        }
        return result;
    }
}
