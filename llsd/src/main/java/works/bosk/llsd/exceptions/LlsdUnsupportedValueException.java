package works.bosk.llsd.exceptions;

/**
 * The value or input form is well-formed, but the codec in use cannot handle it.
 * <p>
 * Examples: a real holding infinity or NaN given to the notation codec,
 * a byte-counted span given to the notation string-variant parser,
 * or a string containing a character that XML 1.0 cannot carry.
 */
public final class LlsdUnsupportedValueException extends LlsdException {
	public LlsdUnsupportedValueException(String message) {
		super(message);
	}

	public LlsdUnsupportedValueException(String message, long offset) {
		super(message, offset);
	}

	public LlsdUnsupportedValueException(String message, long offset, Throwable cause) {
		super(message, offset, cause);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.UNSUPPORTED_VALUE;
	}
}
