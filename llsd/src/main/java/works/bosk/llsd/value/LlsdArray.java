package works.bosk.llsd.value;

import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * An ordered sequence of values. Order is significant for equality.
 */
public record LlsdArray(List<LlsdValue> elements) implements LlsdValue {
	public static final LlsdArray EMPTY = new LlsdArray(List.of());

	public LlsdArray {
		elements = List.copyOf(elements);
	}

	public int size() {
		return elements.size();
	}

	public LlsdValue get(int index) {
		return elements.get(index);
	}

	@Override
	public LlsdType type() {
		return LlsdType.ARRAY;
	}

	@Override
	public List<LlsdValue> asArray() {
		return elements;
	}

	@Override
	public String toString() {
		return elements.stream()
			.map(Object::toString)
			.collect(joining(",", "[", "]"));
	}
}
