package works.bosk.llsd.exceptions;

/**
 * The text or bytes of a scalar value are malformed:
 * a bad UUID, date, number, or binary encoding.
 */
public final class LlsdPrimitiveException extends LlsdFormatException {
	public LlsdPrimitiveException(String message) {
		super(message, UNKNOWN_OFFSET);
	}

	public LlsdPrimitiveException(String message, long offset) {
		super(message, offset);
	}

	public LlsdPrimitiveException(String message, long offset, Throwable cause) {
		super(message, offset, cause);
	}

	/**
	 * The primitive decoders don't know where their text came from.
	 * Parsers call this to attach the position of the offending value.
	 */
	public LlsdPrimitiveException at(long offset) {
		if (offset() == UNKNOWN_OFFSET) {
			return new LlsdPrimitiveException(detail(), offset, this);
		} else {
			return this;
		}
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.INVALID_PRIMITIVE;
	}
}
