package work.optiframe.kernel.runtime;

import java.util.Objects;

/**
 * Identifies one kind of data in a {@link Registry}. Two keys are equal when they wrap the same class.
 */
public final class TypeKey<T> {
    private final Class<T> type;

    private TypeKey(Class<T> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public static <T> TypeKey<T> of(Class<T> type) {
        return new TypeKey<>(type);
    }

    @SuppressWarnings("unchecked")
    public static TypeKey<Object> ofValue(Object value) {
        Objects.requireNonNull(value, "value");
        return new TypeKey<>((Class<Object>) value.getClass());
    }

    public Class<T> type() {
        return type;
    }

    public String name() {
        return type.getSimpleName().isEmpty() ? type.getName() : type.getSimpleName();
    }

    public T cast(Object value) {
        if (value != null && !type.isInstance(value)) {
            throw new ClassCastException("Value of type " + value.getClass().getName() + " is not a " + name());
        }
        return type.cast(value);
    }

    public boolean accepts(Object value) {
        return type.isInstance(value);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TypeKey<?> key && key.type == type;
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return name();
    }
}
