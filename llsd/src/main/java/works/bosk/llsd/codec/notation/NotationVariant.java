package works.bosk.llsd.codec.notation;

/**
 * The two flavours of LLSD notation.
 */
public enum NotationVariant {
	/**
	 * May contain byte-counted spans like {@code s(5)"hello"} and {@code b(3)"..."}
	 * holding arbitrary bytes, so output is not necessarily valid text.
	 * Never embed it in an XML document.
	 */
	BYTES,

	/**
	 * Only quoted strings and base64 or base16 binary values.
	 * Output is always valid UTF-8 and can be carried as XML character data.
	 * The parser rejects byte-counted spans.
	 */
	STRING,
}
