package work.rescuekit.constraint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-valued requirement set: every key maps to a deduplicated, order-preserving list of strings.
 *
 * <p>Used both to describe what a module needs (domain, class, distro, sudo, ...) and to hold the
 * union of all module requirements when computing applicability. Values are normalized by
 * {@link #toStringList(Object)} at every entry point, so callers may hand in scalars, space-delimited
 * strings, collections or nested maps.</p>
 */
public final class Constraint {
    private static final Logger log = LoggerFactory.getLogger(Constraint.class);

    private final Map<String, List<String>> values = new LinkedHashMap<>();

    public Constraint() {}

    public Constraint(Map<String, ?> initial) {
        if (initial != null) {
            update(initial);
        }
    }

    /**
     * Convenience factory taking alternating key/value arguments.
     */
    public static Constraint of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Constraint.of expects key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new Constraint(map);
    }

    /**
     * Folds an arbitrary value into a list of strings.
     *
     * <ul>
     *   <li>{@code null}, empty or blank strings become an empty list</li>
     *   <li>strings containing whitespace are split into several values</li>
     *   <li>collections and arrays keep one value per non-null element</li>
     *   <li>maps contribute their keys</li>
     *   <li>any other scalar becomes a single-value list</li>
     * </ul>
     * The result never contains duplicates and keeps first-seen order.
     */
    public static List<String> toStringList(Object value) {
        if (value == null) {
            return new ArrayList<>();
        }
        Collection<?> items;
        if (value instanceof String str) {
            String trimmed = str.trim();
            if (trimmed.isEmpty()) {
                return new ArrayList<>();
            }
            items = Arrays.asList(trimmed.split("\\s+"));
        } else if (value instanceof Map<?, ?> map) {
            items = map.keySet();
        } else if (value instanceof Collection<?> collection) {
            items = collection;
        } else if (value instanceof Object[] array) {
            items = Arrays.asList(array);
        } else {
            items = List.of(value);
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (Object item : items) {
            if (item != null) {
                unique.add(String.valueOf(item));
            }
        }
        return new ArrayList<>(unique);
    }

    /**
     * Replaces the values of {@code key} with the normalized form of {@code value}.
     */
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        values.put(key, toStringList(value));
    }

    /**
     * Deep-merges {@code other} into this constraint.
     *
     * <p>Nested maps are merged key by key into this (flat) constraint. Existing keys gain only the
     * values they do not already hold; new keys adopt a copy of the incoming list. Applying the same
     * update twice leaves the constraint as it was after the first application.</p>
     *
     * @throws ConstraintTypeException when {@code other} is non-null and not map-shaped
     */
    public void update(Object other) {
        if (other == null) {
            return;
        }
        if (other instanceof Constraint constraint) {
            mergeEntries(constraint.values);
            return;
        }
        if (!(other instanceof Map<?, ?> map)) {
            log.debug("Rejecting constraint update from {}", other.getClass().getName());
            throw new ConstraintTypeException(other);
        }
        mergeEntries(map);
    }

    private void mergeEntries(Map<?, ?> entries) {
        for (var entry : entries.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object raw = entry.getValue();
            if (raw instanceof Map<?, ?> nested) {
                mergeEntries(nested);
            } else if (raw instanceof Constraint nested) {
                mergeEntries(nested.values);
            } else {
                merge(key, toStringList(raw));
            }
        }
    }

    private void merge(String key, List<String> incoming) {
        List<String> existing = values.get(key);
        if (existing == null) {
            values.put(key, new ArrayList<>(incoming));
            return;
        }
        for (String value : incoming) {
            if (!existing.contains(value)) {
                existing.add(value);
            }
        }
    }

    /**
     * Returns a new constraint holding only the given keys.
     */
    public Constraint withKeys(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        Constraint projected = new Constraint();
        values.forEach((key, list) -> {
            if (keys.contains(key)) {
                projected.values.put(key, new ArrayList<>(list));
            }
        });
        return projected;
    }

    /**
     * Returns a new constraint holding every key except the given ones.
     */
    public Constraint withoutKeys(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        Constraint projected = new Constraint();
        values.forEach((key, list) -> {
            if (!keys.contains(key)) {
                projected.values.put(key, new ArrayList<>(list));
            }
        });
        return projected;
    }

    /**
     * Membership test with three query shapes.
     *
     * <ul>
     *   <li>a scalar is a plain key lookup</li>
     *   <li>a list/collection/array is true only when every element matches and the query is not empty</li>
     *   <li>a map {@code {k: v}} checks that {@code v} is among the values of {@code k}; when {@code v} is
     *       itself a collection, one matching element is enough. With several keys the last key decides.</li>
     * </ul>
     */
    public boolean contains(Object query) {
        if (query == null) {
            return false;
        }
        if (isSequence(query)) {
            List<?> items = asSequence(query);
            if (items.isEmpty()) {
                return false;
            }
            for (Object item : items) {
                if (!contains(item)) {
                    return false;
                }
            }
            return true;
        }
        if (!(query instanceof Map<?, ?> map)) {
            return values.containsKey(String.valueOf(query));
        }
        boolean result = false;
        for (var entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object wanted = entry.getValue();
            if (isSequence(wanted)) {
                result = false;
                for (Object candidate : asSequence(wanted)) {
                    if (contains(Collections.singletonMap(key, candidate))) {
                        result = true;
                        break;
                    }
                }
            } else if (values.containsKey(key)) {
                result = wanted != null && values.get(key).contains(String.valueOf(wanted));
            } else {
                result = false;
            }
        }
        return result;
    }

    /**
     * Convenience for {@code contains(Map.of(key, value))}.
     */
    public boolean containsValue(String key, String value) {
        List<String> list = values.get(key);
        return list != null && list.contains(value);
    }

    private static boolean isSequence(Object value) {
        return value instanceof Collection<?> || value instanceof Object[];
    }

    private static List<?> asSequence(Object value) {
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return new ArrayList<>((Collection<?>) value);
    }

    public boolean hasKey(String key) {
        return values.containsKey(key);
    }

    /**
     * Values for {@code key}, or an empty list when the key is absent.
     */
    public List<String> get(String key) {
        List<String> list = values.get(key);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /**
     * First value for {@code key}, or an empty string.
     */
    public String first(String key) {
        List<String> list = values.get(key);
        return list == null || list.isEmpty() ? "" : list.get(0);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, List<String>> asMap() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        values.forEach((key, list) -> copy.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constraint other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
