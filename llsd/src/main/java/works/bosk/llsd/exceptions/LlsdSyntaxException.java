package works.bosk.llsd.exceptions;

/**
 * The input violates the grammar of its format: bad header, truncated buffer,
 * unterminated string, unmatched delimiter, malformed XML, or a misplaced element.
 */
public final class LlsdSyntaxException extends LlsdFormatException {
	public LlsdSyntaxException(String message) {
		super(message, UNKNOWN_OFFSET);
	}

	public LlsdSyntaxException(String message, long offset) {
		super(message, offset);
	}

	public LlsdSyntaxException(String message, long offset, Throwable cause) {
		super(message, offset, cause);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.MALFORMED_STRUCTURE;
	}
}
