package works.bosk.llsd.primitives;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import works.bosk.llsd.exceptions.LlsdSyntaxException;
import works.bosk.llsd.exceptions.LlsdUnsupportedValueException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Strict UTF-8 conversions.
 * {@link String#String(byte[], java.nio.charset.Charset)} and {@link String#getBytes(java.nio.charset.Charset)}
 * silently substitute replacement characters; these methods throw instead.
 */
public final class Utf8 {
	private Utf8() { }

	/**
	 * @param inputOffset position of {@code bytes[start]} in the original input, for error messages
	 * @throws LlsdSyntaxException if the bytes are not well-formed UTF-8
	 */
	public static String decode(byte[] bytes, int start, int length, long inputOffset) {
		try {
			return UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(bytes, start, length))
				.toString();
		} catch (CharacterCodingException e) {
			throw new LlsdSyntaxException("Invalid UTF-8 text", inputOffset, e);
		}
	}

	public static String decode(byte[] bytes, long inputOffset) {
		return decode(bytes, 0, bytes.length, inputOffset);
	}

	/**
	 * @throws LlsdUnsupportedValueException if {@code text} contains an unpaired surrogate
	 */
	public static byte[] encode(CharSequence text) {
		try {
			ByteBuffer buffer = UTF_8.newEncoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.encode(CharBuffer.wrap(text));
			byte[] result = new byte[buffer.remaining()];
			buffer.get(result);
			return result;
		} catch (CharacterCodingException e) {
			throw new LlsdUnsupportedValueException("String is not valid Unicode", LlsdUnsupportedValueException.UNKNOWN_OFFSET, e);
		}
	}
}
