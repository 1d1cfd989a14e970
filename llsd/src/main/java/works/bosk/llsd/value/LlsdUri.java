package works.bosk.llsd.value;

import static java.util.Objects.requireNonNull;

/**
 * A URI, held as the text it was given. No normalization or validation is performed.
 */
public record LlsdUri(String value) implements LlsdValue {
	public LlsdUri {
		requireNonNull(value);
	}

	@Override
	public LlsdType type() {
		return LlsdType.URI;
	}

	@Override
	public String asUri() {
		return value;
	}

	@Override
	public String toString() {
		return "l\"" + value + '"';
	}
}
