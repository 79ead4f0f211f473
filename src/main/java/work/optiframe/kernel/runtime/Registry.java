package work.optiframe.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Holds at most one value per {@link TypeKey}. Threaded through every step of a workflow and handed back
 * to the caller as the result. Writing a key that already has a value replaces it.
 *
 * <p>Not safe for concurrent mutation; the scheduler serialises every write.
 */
public final class Registry {
    private final Map<TypeKey<?>, Object> values = new LinkedHashMap<>();

    public Registry() {}

    private Registry(Map<TypeKey<?>, Object> values) {
        this.values.putAll(values);
    }

    /**
     * Builds a registry keyed by the runtime class of each seed. {@code null} seeds are skipped and later
     * seeds of the same class replace earlier ones.
     */
    public static Registry of(Object... seeds) {
        var registry = new Registry();
        if (seeds == null) {
            return registry;
        }
        for (Object seed : seeds) {
            if (seed != null) {
                registry.put(seed);
            }
        }
        return registry;
    }

    public <T> Optional<T> get(TypeKey<T> key) {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(key.cast(values.get(key)));
    }

    public <T> Optional<T> get(Class<T> type) {
        return get(TypeKey.of(type));
    }

    public <T> T require(TypeKey<T> key) {
        return get(key).orElseThrow(() -> new NoSuchElementException("No value registered for " + key.name()));
    }

    public <T> T require(Class<T> type) {
        return require(TypeKey.of(type));
    }

    /**
     * Stores {@code value} under {@code key}, replacing any previous value.
     *
     * @return the previous value, if any
     */
    public <T> Optional<T> set(TypeKey<T> key, T value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, () -> "value for " + key.name());
        return Optional.ofNullable(key.cast(values.put(key, key.cast(value))));
    }

    public Optional<Object> put(Object value) {
        return set(TypeKey.ofValue(value), value);
    }

    public boolean contains(TypeKey<?> key) {
        return values.containsKey(key);
    }

    public boolean contains(Class<?> type) {
        return contains(TypeKey.of(type));
    }

    public <T> Optional<T> remove(TypeKey<T> key) {
        return Optional.ofNullable(key.cast(values.remove(key)));
    }

    public Set<TypeKey<?>> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Registry snapshot() {
        return new Registry(values);
    }

    @Override
    public String toString() {
        return "Registry" + values.keySet();
    }
}
