package works.bosk.llsd.codec.notation;

/**
 * Fixed text shared by the notation parser and generator.
 */
final class NotationSyntax {
	static final String HEADER = "<? llsd/notation ?>";

	static final char UNDEFINED = '!';
	static final char INTEGER = 'i';
	static final char REAL = 'r';
	static final char UUID = 'u';
	static final char COUNTED_STRING = 's';
	static final char URI = 'l';
	static final char DATE = 'd';
	static final char BINARY = 'b';
	static final char ARRAY_OPEN = '[';
	static final char ARRAY_CLOSE = ']';
	static final char MAP_OPEN = '{';
	static final char MAP_CLOSE = '}';
	static final char SEPARATOR = ',';
	static final char KEY_SEPARATOR = ':';
	static final char COUNT_OPEN = '(';
	static final char COUNT_CLOSE = ')';
	static final char ESCAPE = '\\';

	private NotationSyntax() { }

	static boolean isWhitespace(int c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	static boolean isQuote(int c) {
		return c == '"' || c == '\'';
	}

	/**
	 * @return the character denoted by {@code \c}, for the single-character escapes other than {@code \x}
	 */
	static int unescape(int c) {
		return switch (c) {
			case 'a' -> 0x07;
			case 'b' -> '\b';
			case 'f' -> '\f';
			case 'n' -> '\n';
			case 'r' -> '\r';
			case 't' -> '\t';
			case 'v' -> 0x0B;
			default -> c;
		};
	}

	static String describe(int c) {
		if (c == NotationReader.END) {
			return "end of input";
		} else if (c >= 0x20 && c < 0x7F) {
			return "'" + (char) c + "'";
		} else {
			return String.format("U+%04X", c);
		}
	}
}
