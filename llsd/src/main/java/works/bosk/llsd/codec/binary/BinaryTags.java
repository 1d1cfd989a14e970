package works.bosk.llsd.codec.binary;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Byte values of the binary LLSD wire format.
 * These are fixed by the protocol and shared with independent implementations.
 */
final class BinaryTags {
	static final byte[] HEADER = "<? LLSD/Binary ?>\n".getBytes(US_ASCII);

	static final byte UNDEFINED = '!';
	static final byte TRUE = '1';
	static final byte FALSE = '0';
	static final byte INTEGER = 'i';
	static final byte REAL = 'r';
	static final byte UUID = 'u';
	static final byte STRING = 's';
	static final byte DATE = 'd';
	static final byte URI = 'l';
	static final byte BINARY = 'b';
	static final byte ARRAY_OPEN = '[';
	static final byte ARRAY_CLOSE = ']';
	static final byte MAP_OPEN = '{';
	static final byte MAP_CLOSE = '}';
	static final byte MAP_KEY = 'k';

	private BinaryTags() { }

	static String describe(byte tag) {
		if (tag >= 0x20 && tag < 0x7F) {
			return "'" + (char) tag + "'";
		} else {
			return String.format("0x%02x", tag & 0xFF);
		}
	}
}
