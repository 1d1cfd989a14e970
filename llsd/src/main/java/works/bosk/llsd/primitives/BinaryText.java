package works.bosk.llsd.primitives;

import java.util.Base64;
import java.util.HexFormat;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;

/**
 * Text encodings of binary data.
 * <p>
 * On output, base64 uses the standard padded alphabet and base16 uses lowercase digits with no separators.
 * On input, whitespace is ignored (XML documents often wrap long base64 runs),
 * and base16 digits may be of either case.
 */
public final class BinaryText {
	private static final HexFormat HEX = HexFormat.of();

	private BinaryText() { }

	public static String encode(byte[] bytes, BinaryEncoding encoding) {
		return switch (encoding) {
			case BASE64 -> Base64.getEncoder().encodeToString(bytes);
			case BASE16 -> HEX.formatHex(bytes);
		};
	}

	/**
	 * @throws LlsdPrimitiveException if {@code text} is not valid in the given encoding
	 */
	public static byte[] decode(CharSequence text, BinaryEncoding encoding) {
		String compact = withoutWhitespace(text);
		try {
			return switch (encoding) {
				case BASE64 -> Base64.getDecoder().decode(compact);
				case BASE16 -> HEX.parseHex(compact);
			};
		} catch (IllegalArgumentException e) {
			throw new LlsdPrimitiveException("Invalid " + encoding.attributeValue() + " text: " + e.getMessage(), LlsdPrimitiveException.UNKNOWN_OFFSET, e);
		}
	}

	/**
	 * @return the encoding with the given XML attribute value,
	 * accepting {@code hex} as a synonym for {@code base16}
	 * @throws LlsdPrimitiveException if the name is not recognized
	 */
	public static BinaryEncoding encodingNamed(String name) {
		return switch (name) {
			case "base64" -> BinaryEncoding.BASE64;
			case "base16", "hex" -> BinaryEncoding.BASE16;
			default -> throw new LlsdPrimitiveException("Unsupported binary encoding \"" + name + "\"");
		};
	}

	private static String withoutWhitespace(CharSequence text) {
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (!isWhitespace(c)) {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}
}
