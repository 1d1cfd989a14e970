package works.bosk.llsd.codec.notation;

import java.io.ByteArrayOutputStream;
import works.bosk.llsd.exceptions.LlsdUnsupportedValueException;
import works.bosk.llsd.primitives.BinaryEncoding;
import works.bosk.llsd.primitives.BinaryText;
import works.bosk.llsd.primitives.DateText;
import works.bosk.llsd.primitives.RealText;
import works.bosk.llsd.primitives.UuidText;
import works.bosk.llsd.primitives.Utf8;
import works.bosk.llsd.value.LlsdValue;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Writes one value as notation.
 * Output is compact: no whitespace between tokens.
 */
final class NotationGenerator {
	private final NotationVariant variant;
	private final BinaryEncoding binaryEncoding;
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();

	NotationGenerator(NotationVariant variant, BinaryEncoding binaryEncoding) {
		this.variant = variant;
		this.binaryEncoding = binaryEncoding;
	}

	byte[] generateDocument(LlsdValue value, boolean writeHeader) {
		if (writeHeader) {
			ascii(NotationSyntax.HEADER + "\n");
		}
		generate(value);
		return out.toByteArray();
	}

	private void generate(LlsdValue value) {
		switch (value.type()) {
			case UNDEFINED -> out.write(NotationSyntax.UNDEFINED);
			case BOOLEAN -> ascii(value.asBoolean() ? "true" : "false");
			case INTEGER -> ascii(NotationSyntax.INTEGER + Integer.toString(value.asInteger()));
			case REAL -> {
				double real = value.asReal();
				if (!Double.isFinite(real)) {
					throw new LlsdUnsupportedValueException("Notation cannot represent non-finite real " + real);
				}
				ascii(NotationSyntax.REAL + RealText.formatFinite(real));
			}
			case UUID -> ascii(NotationSyntax.UUID + UuidText.format(value.asUuid()));
			case STRING -> quoted(value.asString());
			case DATE -> {
				out.write(NotationSyntax.DATE);
				quoted(DateText.format(value.asDate()));
			}
			case URI -> {
				out.write(NotationSyntax.URI);
				quoted(value.asUri());
			}
			case BINARY -> binary(value.asBinary());
			case ARRAY -> {
				out.write(NotationSyntax.ARRAY_OPEN);
				boolean first = true;
				for (LlsdValue element : value.asArray()) {
					if (!first) {
						out.write(NotationSyntax.SEPARATOR);
					}
					first = false;
					generate(element);
				}
				out.write(NotationSyntax.ARRAY_CLOSE);
			}
			case MAP -> {
				out.write(NotationSyntax.MAP_OPEN);
				boolean first = true;
				for (var entry : value.asMap().entrySet()) {
					if (!first) {
						out.write(NotationSyntax.SEPARATOR);
					}
					first = false;
					quoted(entry.getKey(), '\'');
					out.write(NotationSyntax.KEY_SEPARATOR);
					generate(entry.getValue());
				}
				out.write(NotationSyntax.MAP_CLOSE);
			}
		}
	}

	private void binary(byte[] bytes) {
		switch (variant) {
			case BYTES -> {
				ascii(NotationSyntax.BINARY + "(" + bytes.length + ")\"");
				out.writeBytes(bytes);
				out.write('"');
			}
			case STRING -> {
				ascii(NotationSyntax.BINARY + (binaryEncoding == BinaryEncoding.BASE64 ? "64" : "16"));
				quoted(BinaryText.encode(bytes, binaryEncoding));
			}
		}
	}

	private void quoted(String text) {
		quoted(text, '"');
	}

	/**
	 * Characters that XML 1.0 forbids are written as {@code \x} escapes of their UTF-8 bytes,
	 * so string-variant output is always legal XML character data.
	 */
	private void quoted(String text, char delimiter) {
		StringBuilder sb = new StringBuilder(text.length() + 2);
		sb.append(delimiter);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == delimiter || c == NotationSyntax.ESCAPE) {
				sb.append(NotationSyntax.ESCAPE).append(c);
			} else if (c < 0x20 || c == 0x7F || c == 0xFFFE || c == 0xFFFF) {
				for (byte b : Utf8.encode(String.valueOf(c))) {
					sb.append(String.format("\\x%02x", b & 0xFF));
				}
			} else {
				sb.append(c);
			}
		}
		sb.append(delimiter);
		out.writeBytes(Utf8.encode(sb));
	}

	private void ascii(String text) {
		out.writeBytes(text.getBytes(US_ASCII));
	}
}
