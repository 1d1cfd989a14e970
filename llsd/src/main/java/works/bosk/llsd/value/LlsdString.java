package works.bosk.llsd.value;

import static java.util.Objects.requireNonNull;

public record LlsdString(String value) implements LlsdValue {
	public LlsdString {
		requireNonNull(value);
	}

	@Override
	public LlsdType type() {
		return LlsdType.STRING;
	}

	@Override
	public String asString() {
		return value;
	}

	@Override
	public String toString() {
		return '"' + value + '"';
	}
}
