package org.pragmatica.sifter.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Values collected while parsing one verb, keyed by definition identifier.
 *
 * <p>Options bind their occurrence count, arguments bind their resolved value and
 * a matched subcommand binds a nested record under its identifier.
 */
public final class ResultRecord {

    private final Map<String, Object> values;

    private ResultRecord(Map<String, Object> values) {
        this.values = values;
    }

    public static ResultRecord create() {
        return new ResultRecord(new HashMap<>());
    }

    // === Lookup ===

    public boolean has(String id) {
        return values.containsKey(id);
    }

    public Optional<Object> get(String id) {
        return Optional.ofNullable(values.get(id));
    }

    /**
     * Typed lookup. Fails with {@link ClassCastException} if the bound value has another type.
     */
    public <T> Optional<T> get(String id, Class<T> type) {
        return get(id).map(type::cast);
    }

    /**
     * Occurrence count of an option, zero if it never appeared.
     */
    public int count(String id) {
        return values.get(id) instanceof Integer count
               ? count
               : 0;
    }

    /**
     * Nested record of a matched subcommand.
     */
    public Optional<ResultRecord> subcommand(String id) {
        return values.get(id) instanceof ResultRecord nested
               ? Optional.of(nested)
               : Optional.empty();
    }

    public Set<String> keys() {
        return Set.copyOf(values.keySet());
    }

    public List<Map.Entry<String, Object>> entries() {
        return values.entrySet()
                     .stream()
                     .map(entry -> Map.entry(entry.getKey(), entry.getValue()))
                     .toList();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    // === Mutation ===

    public ResultRecord set(String id, Object value) {
        values.put(id, value);
        return this;
    }

    public boolean delete(String id) {
        if (!values.containsKey(id)) {
            return false;
        }
        values.remove(id);
        return true;
    }

    public void clear() {
        values.clear();
    }

    /**
     * Increment the occurrence counter of an option, starting from zero.
     * A non-numeric binding under the same id is replaced.
     */
    public int increment(String id) {
        var next = count(id) + 1;
        values.put(id, next);
        return next;
    }

    /**
     * Copy all bindings of another record into this one, overwriting on identifier collision.
     */
    public ResultRecord merge(ResultRecord other) {
        values.putAll(other.values);
        return this;
    }

    /**
     * Read-only view of the bindings. Nested records stay as {@link ResultRecord} values.
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResultRecord other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ResultRecord" + values;
    }
}
