package works.bosk.llsd.exceptions;

import works.bosk.llsd.value.LlsdType;

/**
 * A typed accessor was called on a value of a different variant.
 * Values are never coerced from one variant to another.
 */
public final class LlsdTypeMismatchException extends LlsdException {
	private final LlsdType expected;
	private final LlsdType actual;

	public LlsdTypeMismatchException(LlsdType expected, LlsdType actual) {
		super("Expected " + expected + " but value is " + actual);
		this.expected = expected;
		this.actual = actual;
	}

	public LlsdType expected() {
		return expected;
	}

	public LlsdType actual() {
		return actual;
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.TYPE_MISMATCH;
	}
}
