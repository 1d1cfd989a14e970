package works.bosk.llsd.codec.notation;

import java.io.ByteArrayOutputStream;
import java.util.HexFormat;
import works.bosk.llsd.exceptions.LlsdSyntaxException;
import works.bosk.llsd.primitives.Utf8;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Reads the byte variant of notation straight from the input buffer.
 * Quoted text is unescaped at the byte level and then decoded as UTF-8.
 */
final class ByteArrayNotationReader implements NotationReader {
	private final byte[] buffer;
	private int position = 0;

	ByteArrayNotationReader(byte[] buffer) {
		this.buffer = buffer;
	}

	@Override
	public int peek() {
		return peek(0);
	}

	@Override
	public int peek(int ahead) {
		int index = position + ahead;
		return index < buffer.length ? Byte.toUnsignedInt(buffer[index]) : END;
	}

	@Override
	public int next() {
		if (position < buffer.length) {
			return Byte.toUnsignedInt(buffer[position++]);
		} else {
			return END;
		}
	}

	@Override
	public long offset() {
		return position;
	}

	@Override
	public String readQuoted(int delimiter) {
		long start = position - 1;
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		while (true) {
			int b = next();
			if (b == END) {
				throw new LlsdSyntaxException("Unterminated quoted text", start);
			} else if (b == delimiter) {
				byte[] bytes = out.toByteArray();
				return Utf8.decode(bytes, 0, bytes.length, start);
			} else if (b == NotationSyntax.ESCAPE) {
				out.write(readEscape(start));
			} else {
				out.write(b);
			}
		}
	}

	private int readEscape(long start) {
		int e = next();
		if (e == END) {
			throw new LlsdSyntaxException("Unterminated quoted text", start);
		} else if (e == 'x') {
			long escapeOffset = position - 2;
			int high = next();
			int low = next();
			if (!HexFormat.isHexDigit(high) || !HexFormat.isHexDigit(low)) {
				throw new LlsdSyntaxException("Invalid \\x escape", escapeOffset);
			}
			return HexFormat.fromHexDigit(high) << 4 | HexFormat.fromHexDigit(low);
		} else {
			return NotationSyntax.unescape(e);
		}
	}

	@Override
	public boolean supportsByteCounts() {
		return true;
	}

	@Override
	public byte[] readCounted(int length) {
		if (length > buffer.length - position) {
			throw new LlsdSyntaxException("Byte count " + length + " exceeds the " + (buffer.length - position) + " bytes remaining", position);
		}
		byte[] result = new byte[length];
		System.arraycopy(buffer, position, result, 0, length);
		position += length;
		return result;
	}

	@Override
	public String preview(int length) {
		return new String(buffer, position, Math.min(length, buffer.length - position), ISO_8859_1);
	}
}
