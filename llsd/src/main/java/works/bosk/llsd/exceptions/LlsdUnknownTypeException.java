package works.bosk.llsd.exceptions;

/**
 * The input names a type that LLSD does not have,
 * like an unrecognized XML element or binary tag byte.
 */
public final class LlsdUnknownTypeException extends LlsdFormatException {
	public LlsdUnknownTypeException(String message) {
		super(message, UNKNOWN_OFFSET);
	}

	public LlsdUnknownTypeException(String message, long offset) {
		super(message, offset);
	}

	public LlsdUnknownTypeException(String message, long offset, Throwable cause) {
		super(message, offset, cause);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.UNKNOWN_TYPE;
	}
}
