package works.bosk.llsd.codec.binary;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Map;
import works.bosk.llsd.primitives.UuidText;
import works.bosk.llsd.primitives.Utf8;
import works.bosk.llsd.value.LlsdValue;

/**
 * Encodes one value tree as binary LLSD.
 * Each instance accumulates one document.
 */
final class BinaryGenerator {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();

	byte[] generateDocument(LlsdValue value, boolean writeHeader) {
		if (writeHeader) {
			out.writeBytes(BinaryTags.HEADER);
		}
		generate(value);
		return out.toByteArray();
	}

	private void generate(LlsdValue value) {
		out.write(tagFor(value));
		switch (value.type()) {
			case UNDEFINED, BOOLEAN -> { }
			case INTEGER -> writeInt(value.asInteger());
			case REAL -> writeLong(Double.doubleToRawLongBits(value.asReal()));
			case UUID -> out.writeBytes(UuidText.toBytes(value.asUuid()));
			case STRING -> writeText(value.asString());
			case DATE -> writeLong(value.asDate());
			case URI -> writeText(value.asUri());
			case BINARY -> {
				byte[] bytes = value.asBinary();
				writeInt(bytes.length);
				out.writeBytes(bytes);
			}
			case ARRAY -> {
				List<LlsdValue> elements = value.asArray();
				writeInt(elements.size());
				elements.forEach(this::generate);
				out.write(BinaryTags.ARRAY_CLOSE);
			}
			case MAP -> {
				Map<String, LlsdValue> entries = value.asMap();
				writeInt(entries.size());
				entries.forEach((key, member) -> {
					out.write(BinaryTags.MAP_KEY);
					writeText(key);
					generate(member);
				});
				out.write(BinaryTags.MAP_CLOSE);
			}
		}
	}

	private static byte tagFor(LlsdValue value) {
		return switch (value.type()) {
			case UNDEFINED -> BinaryTags.UNDEFINED;
			case BOOLEAN -> value.asBoolean() ? BinaryTags.TRUE : BinaryTags.FALSE;
			case INTEGER -> BinaryTags.INTEGER;
			case REAL -> BinaryTags.REAL;
			case UUID -> BinaryTags.UUID;
			case STRING -> BinaryTags.STRING;
			case DATE -> BinaryTags.DATE;
			case URI -> BinaryTags.URI;
			case BINARY -> BinaryTags.BINARY;
			case ARRAY -> BinaryTags.ARRAY_OPEN;
			case MAP -> BinaryTags.MAP_OPEN;
		};
	}

	private void writeText(String text) {
		byte[] bytes = Utf8.encode(text);
		writeInt(bytes.length);
		out.writeBytes(bytes);
	}

	private void writeInt(int value) {
		out.write(value >>> 24);
		out.write(value >>> 16);
		out.write(value >>> 8);
		out.write(value);
	}

	private void writeLong(long value) {
		writeInt((int) (value >>> 32));
		writeInt((int) value);
	}
}
