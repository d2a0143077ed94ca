package io.github.yok.flexrecords.model;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A single field value of a record in a content batch.
 *
 * <p>
 * The set of variants is closed: every subclass lives in this package and the constructor is
 * package-private. Consumers dispatch on {@link #getKind()} instead of inspecting runtime types.
 * </p>
 *
 * <ul>
 * <li>{@link Kind#SCALAR}: {@link Scalar} - text, number, boolean, {@code null} or any other JDBC
 * bindable value</li>
 * <li>{@link Kind#LOCAL_REF}: {@link LocalReference} - a record of the same or a previous batch</li>
 * <li>{@link Kind#DB_REF}: {@link DbReference} - a pre-existing row matched by column values</li>
 * <li>{@link Kind#NESTED}: {@link Nested} - a nested object (e.g. the content of a JSON column)</li>
 * <li>{@link Kind#LIST}: {@link ListValue} - an ordered sequence of values</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class RecordValue {

    /**
     * Variant tag of a {@link RecordValue}.
     */
    public enum Kind {
        // Plain bind value
        SCALAR,
        // Reference to a record registered by the engine
        LOCAL_REF,
        // Reference to a row found by an equality lookup
        DB_REF,
        // Nested object
        NESTED,
        // Ordered sequence
        LIST
    }

    /**
     * Restricts subclasses to this package.
     */
    RecordValue() {}

    /**
     * Returns the variant tag of this value.
     *
     * @return variant tag
     */
    public abstract Kind getKind();

    /**
     * Returns {@code true} if this value is a local or database reference.
     *
     * @return whether this value must be resolved before writing
     */
    public boolean isReference() {
        return getKind() == Kind.LOCAL_REF || getKind() == Kind.DB_REF;
    }

    /**
     * Converts a plain Java value into a {@link RecordValue}.
     *
     * <ul>
     * <li>a {@link RecordValue} is returned as is</li>
     * <li>a {@link RecordParams} or {@link Map} becomes {@link Nested}</li>
     * <li>a {@link Collection} or an object array becomes {@link ListValue}</li>
     * <li>anything else (including {@code null} and {@code byte[]}) becomes {@link Scalar}</li>
     * </ul>
     *
     * @param value plain value
     * @return wrapped value
     */
    public static RecordValue of(Object value) {
        if (value instanceof RecordValue) {
            return (RecordValue) value;
        }
        if (value instanceof RecordParams) {
            return new Nested((RecordParams) value);
        }
        if (value instanceof Map) {
            return new Nested(RecordParams.from((Map<?, ?>) value));
        }
        if (value instanceof Collection) {
            List<RecordValue> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        if (value != null && value.getClass().isArray()
                && !value.getClass().getComponentType().isPrimitive()) {
            List<RecordValue> items = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                items.add(of(Array.get(value, i)));
            }
            return new ListValue(items);
        }
        return new Scalar(value);
    }

    /**
     * Shortcut for {@code new Scalar(value)}.
     *
     * @param value scalar value
     * @return scalar wrapper
     */
    public static Scalar scalar(Object value) {
        return new Scalar(value);
    }
}
