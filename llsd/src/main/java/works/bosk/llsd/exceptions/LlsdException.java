package works.bosk.llsd.exceptions;

/**
 * Root of every exception thrown by the LLSD codecs.
 * <p>
 * A parse or serialize operation either returns a complete result
 * or throws exactly one of these; there is no partial result.
 */
public sealed abstract class LlsdException extends RuntimeException permits
	LlsdFormatException,
	LlsdTypeMismatchException,
	LlsdUnsupportedValueException
{
	public static final long UNKNOWN_OFFSET = -1;

	private final String detail;
	private final long offset;

	protected LlsdException(String message) {
		this(message, UNKNOWN_OFFSET);
	}

	protected LlsdException(String message, long offset) {
		super(withOffset(message, offset));
		this.detail = message;
		this.offset = offset;
	}

	protected LlsdException(String message, long offset, Throwable cause) {
		super(withOffset(message, offset), cause);
		this.detail = message;
		this.offset = offset;
	}

	public abstract ErrorKind kind();

	/**
	 * @return the message without any position information
	 */
	public String detail() {
		return detail;
	}

	/**
	 * @return the byte or character offset in the input where the problem was detected,
	 * or {@link #UNKNOWN_OFFSET} if there is no meaningful position
	 */
	public long offset() {
		return offset;
	}

	private static String withOffset(String message, long offset) {
		if (offset == UNKNOWN_OFFSET) {
			return message;
		} else {
			return message + " at offset " + offset;
		}
	}
}
