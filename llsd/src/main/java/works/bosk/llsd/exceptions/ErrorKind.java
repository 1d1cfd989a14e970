package works.bosk.llsd.exceptions;

/**
 * The categories of failure a caller can see from this library.
 * Each concrete {@link LlsdException} subclass reports exactly one of these.
 */
public enum ErrorKind {
	/**
	 * A grammar violation: unmatched delimiter, bad header, truncated buffer,
	 * malformed XML, or a structure in the wrong shape.
	 */
	MALFORMED_STRUCTURE,

	/**
	 * A type tag or element name that is not part of LLSD.
	 */
	UNKNOWN_TYPE,

	/**
	 * A typed accessor was called on the wrong variant.
	 */
	TYPE_MISMATCH,

	/**
	 * The text of a UUID, date, number, or binary encoding is malformed.
	 */
	INVALID_PRIMITIVE,

	/**
	 * A well-formed value or form that the chosen codec cannot handle,
	 * like infinity in notation or a byte-counted span in notation text.
	 */
	UNSUPPORTED_VALUE,
}
