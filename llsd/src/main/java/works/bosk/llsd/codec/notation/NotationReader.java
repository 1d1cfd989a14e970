package works.bosk.llsd.codec.notation;

import works.bosk.llsd.exceptions.LlsdSyntaxException;

/**
 * Low-level access to notation input for {@link NotationParser}.
 * <p>
 * All the syntactically significant characters of notation are ASCII,
 * so the parser can work in terms of {@code int} units that are bytes for
 * {@link ByteArrayNotationReader} and UTF-16 chars for {@link CharArrayNotationReader}.
 * The two differ only in how quoted text is decoded and whether byte-counted spans are allowed.
 */
sealed interface NotationReader permits ByteArrayNotationReader, CharArrayNotationReader {
	int END = -1;

	/**
	 * @return the next unit without consuming it, or {@link #END}
	 */
	int peek();

	/**
	 * @return the unit {@code ahead} places after the next one, or {@link #END}
	 */
	int peek(int ahead);

	/**
	 * @return the next unit, or {@link #END}, consuming it
	 */
	int next();

	/**
	 * @return the position of the next unit in the input
	 */
	long offset();

	/**
	 * Call after consuming the opening delimiter.
	 * Consumes the text through the closing delimiter, decoding backslash escapes.
	 *
	 * @throws LlsdSyntaxException if the input ends first
	 */
	String readQuoted(int delimiter);

	boolean supportsByteCounts();

	/**
	 * @return exactly {@code length} raw bytes
	 * @throws works.bosk.llsd.exceptions.LlsdUnsupportedValueException if this reader does not {@link #supportsByteCounts support byte counts}
	 * @throws LlsdSyntaxException if fewer bytes remain
	 */
	byte[] readCounted(int length);

	/**
	 * On a best-effort basis, return the upcoming characters in the input. For diagnostics.
	 */
	String preview(int length);

	default void skipWhitespace() {
		while (NotationSyntax.isWhitespace(peek())) {
			next();
		}
	}

	/**
	 * If the input continues with {@code ascii}, consumes it.
	 *
	 * @return whether the text was consumed
	 */
	default boolean consumeIf(String ascii) {
		for (int i = 0; i < ascii.length(); i++) {
			if (peek(i) != ascii.charAt(i)) {
				return false;
			}
		}
		for (int i = 0; i < ascii.length(); i++) {
			next();
		}
		return true;
	}

	/**
	 * @throws LlsdSyntaxException if the next unit is not {@code expected}
	 */
	default void expect(char expected, String context) {
		long offset = offset();
		int actual = next();
		if (actual != expected) {
			throw new LlsdSyntaxException("Expected '" + expected + "' " + context + " but found " + NotationSyntax.describe(actual), offset);
		}
	}
}
