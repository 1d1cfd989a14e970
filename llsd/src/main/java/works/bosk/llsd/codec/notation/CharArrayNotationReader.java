package works.bosk.llsd.codec.notation;

import java.io.ByteArrayOutputStream;
import java.util.HexFormat;
import works.bosk.llsd.exceptions.LlsdSyntaxException;
import works.bosk.llsd.exceptions.LlsdUnsupportedValueException;
import works.bosk.llsd.primitives.Utf8;

/**
 * Reads the string variant of notation from already-decoded text.
 * Offsets count UTF-16 chars.
 */
final class CharArrayNotationReader implements NotationReader {
	private final CharSequence text;
	private int position = 0;

	CharArrayNotationReader(CharSequence text) {
		this.text = text;
	}

	@Override
	public int peek() {
		return peek(0);
	}

	@Override
	public int peek(int ahead) {
		int index = position + ahead;
		return index < text.length() ? text.charAt(index) : END;
	}

	@Override
	public int next() {
		if (position < text.length()) {
			return text.charAt(position++);
		} else {
			return END;
		}
	}

	@Override
	public long offset() {
		return position;
	}

	/**
	 * A {@code \xHH} escape denotes a byte, as in the byte variant,
	 * so each run of them is decoded as UTF-8 before it joins the text.
	 */
	@Override
	public String readQuoted(int delimiter) {
		long start = position - 1;
		StringBuilder sb = new StringBuilder();
		ByteArrayOutputStream escapedBytes = new ByteArrayOutputStream();
		long escapedOffset = start;
		while (true) {
			int c = next();
			if (c == END) {
				throw new LlsdSyntaxException("Unterminated quoted text", start);
			} else if (c == NotationSyntax.ESCAPE && peek() == 'x') {
				if (escapedBytes.size() == 0) {
					escapedOffset = position - 1;
				}
				escapedBytes.write(readHexEscape());
				continue;
			}
			flush(escapedBytes, escapedOffset, sb);
			if (c == delimiter) {
				return sb.toString();
			} else if (c == NotationSyntax.ESCAPE) {
				int e = next();
				if (e == END) {
					throw new LlsdSyntaxException("Unterminated quoted text", start);
				}
				sb.append((char) NotationSyntax.unescape(e));
			} else {
				sb.append((char) c);
			}
		}
	}

	/**
	 * Call with the {@code x} of a {@code \xHH} escape as the next char.
	 */
	private int readHexEscape() {
		long escapeOffset = position - 1;
		next();
		int high = next();
		int low = next();
		if (!HexFormat.isHexDigit(high) || !HexFormat.isHexDigit(low)) {
			throw new LlsdSyntaxException("Invalid \\x escape", escapeOffset);
		}
		return HexFormat.fromHexDigit(high) << 4 | HexFormat.fromHexDigit(low);
	}

	private static void flush(ByteArrayOutputStream escapedBytes, long offset, StringBuilder sb) {
		if (escapedBytes.size() > 0) {
			byte[] bytes = escapedBytes.toByteArray();
			sb.append(Utf8.decode(bytes, 0, bytes.length, offset));
			escapedBytes.reset();
		}
	}

	@Override
	public boolean supportsByteCounts() {
		return false;
	}

	@Override
	public byte[] readCounted(int length) {
		throw new LlsdUnsupportedValueException("Byte-counted spans are not allowed in notation text", position);
	}

	@Override
	public String preview(int length) {
		return text.subSequence(position, Math.min(text.length(), position + length)).toString();
	}
}
