package works.bosk.llsd.exceptions;

/**
 * The input document is not valid for the codec reading it.
 */
public sealed abstract class LlsdFormatException extends LlsdException permits
	LlsdPrimitiveException,
	LlsdSyntaxException,
	LlsdUnknownTypeException
{
	protected LlsdFormatException(String message, long offset) {
		super(message, offset);
	}

	protected LlsdFormatException(String message, long offset, Throwable cause) {
		super(message, offset, cause);
	}
}
