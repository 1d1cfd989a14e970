package works.bosk.llsd.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A mapping from string keys to values.
 * <p>
 * Iteration order is not significant for {@link #equals equality},
 * but it is stable, and serializers emit entries in this order,
 * so generating the same map twice produces the same output.
 * When built with a {@link Builder}, a key that is written more than once
 * keeps only its last value, positioned where that last write occurred.
 */
public record LlsdMap(Map<String, LlsdValue> entries) implements LlsdValue {
	public static final LlsdMap EMPTY = new LlsdMap(Map.of());

	public LlsdMap {
		LinkedHashMap<String, LlsdValue> copy = new LinkedHashMap<>(entries.size() * 2);
		entries.forEach((k, v) -> copy.put(requireNonNull(k), requireNonNull(v)));
		entries = Collections.unmodifiableMap(copy);
	}

	public static Builder builder() {
		return new Builder();
	}

	public int size() {
		return entries.size();
	}

	/**
	 * @return the value for {@code key}, or null if there is none
	 */
	public LlsdValue get(String key) {
		return entries.get(key);
	}

	public boolean containsKey(String key) {
		return entries.containsKey(key);
	}

	@Override
	public LlsdType type() {
		return LlsdType.MAP;
	}

	@Override
	public Map<String, LlsdValue> asMap() {
		return entries;
	}

	@Override
	public String toString() {
		return entries.entrySet().stream()
			.map(e -> "'" + e.getKey() + "':" + e.getValue())
			.collect(joining(",", "{", "}"));
	}

	/**
	 * Accumulates entries with last-write-wins semantics.
	 * Every parser builds maps with this class so that duplicate keys
	 * are treated the same way in all formats.
	 */
	public static final class Builder {
		private final LinkedHashMap<String, LlsdValue> entries = new LinkedHashMap<>();

		private Builder() { }

		public Builder put(String key, LlsdValue value) {
			requireNonNull(key);
			requireNonNull(value);
			// Move the key to the position of its latest write
			entries.remove(key);
			entries.put(key, value);
			return this;
		}

		public Builder putAll(Map<String, ? extends LlsdValue> map) {
			map.forEach(this::put);
			return this;
		}

		public int size() {
			return entries.size();
		}

		public LlsdMap build() {
			return new LlsdMap(entries);
		}
	}
}
