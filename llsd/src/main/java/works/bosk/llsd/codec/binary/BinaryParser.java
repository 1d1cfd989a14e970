package works.bosk.llsd.codec.binary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.llsd.exceptions.LlsdSyntaxException;
import works.bosk.llsd.exceptions.LlsdUnknownTypeException;
import works.bosk.llsd.primitives.UuidText;
import works.bosk.llsd.primitives.Utf8;
import works.bosk.llsd.value.LlsdMap;
import works.bosk.llsd.value.LlsdValue;

import static works.bosk.llsd.codec.binary.BinaryTags.describe;

/**
 * Decodes one binary LLSD document.
 * Holds the read position, so each instance is good for one call to {@link #parseDocument}.
 */
final class BinaryParser {
	private final byte[] buffer;
	private final int maxDepth;
	private int pos;
	private int depth = 0;

	BinaryParser(byte[] buffer, int maxDepth) {
		this.buffer = buffer;
		this.maxDepth = maxDepth;
	}

	LlsdValue parseDocument(boolean expectHeader) {
		if (expectHeader) {
			readHeader();
		}
		LlsdValue result = parseValue();
		checkTrailingBytes();
		return result;
	}

	private void readHeader() {
		int length = BinaryTags.HEADER.length;
		if (buffer.length < length || !Arrays.equals(buffer, 0, length, BinaryTags.HEADER, 0, length)) {
			throw new LlsdSyntaxException("Missing binary LLSD header", 0);
		}
		pos = length;
	}

	private LlsdValue parseValue() {
		int tagOffset = pos;
		byte tag = readByte();
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} @ {}", describe(tag), tagOffset);
		}
		return switch (tag) {
			case BinaryTags.UNDEFINED -> LlsdValue.undefined();
			case BinaryTags.TRUE -> LlsdValue.of(true);
			case BinaryTags.FALSE -> LlsdValue.of(false);
			case BinaryTags.INTEGER -> LlsdValue.of(readInt());
			case BinaryTags.REAL -> LlsdValue.of(Double.longBitsToDouble(readLong()));
			case BinaryTags.UUID -> {
				require(UuidText.BYTE_LENGTH, "UUID");
				var uuid = UuidText.fromBytes(buffer, pos);
				pos += UuidText.BYTE_LENGTH;
				yield LlsdValue.of(uuid);
			}
			case BinaryTags.STRING -> LlsdValue.of(readText("string"));
			case BinaryTags.DATE -> LlsdValue.date(readLong());
			case BinaryTags.URI -> LlsdValue.uri(readText("URI"));
			case BinaryTags.BINARY -> LlsdValue.binary(readBytes(readLength("binary"), "binary"));
			case BinaryTags.ARRAY_OPEN -> parseArray();
			case BinaryTags.MAP_OPEN -> parseMap();
			default -> throw new LlsdUnknownTypeException("Unknown binary LLSD tag " + describe(tag), tagOffset);
		};
	}

	private LlsdValue parseArray() {
		enter();
		int count = readCount("array");
		List<LlsdValue> elements = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			elements.add(parseValue());
		}
		expectClose(BinaryTags.ARRAY_CLOSE, "array");
		exit();
		return LlsdValue.array(elements);
	}

	private LlsdValue parseMap() {
		enter();
		int count = readCount("map");
		LlsdMap.Builder builder = LlsdMap.builder();
		for (int i = 0; i < count; i++) {
			int keyOffset = pos;
			byte keyTag = readByte();
			if (keyTag != BinaryTags.MAP_KEY) {
				throw new LlsdSyntaxException("Expected map key tag 'k' but found " + describe(keyTag), keyOffset);
			}
			String key = readText("map key");
			builder.put(key, parseValue());
		}
		expectClose(BinaryTags.MAP_CLOSE, "map");
		exit();
		return builder.build();
	}

	private void enter() {
		if (++depth > maxDepth) {
			throw new LlsdSyntaxException("Nesting deeper than " + maxDepth, pos - 1);
		}
	}

	private void exit() {
		--depth;
	}

	private void expectClose(byte expected, String what) {
		int offset = pos;
		byte actual = readByte();
		if (actual != expected) {
			throw new LlsdSyntaxException("Expected " + what + " to end with " + describe(expected) + " but found " + describe(actual), offset);
		}
	}

	/**
	 * Assets in the wild are sometimes NUL-padded after the value. Anything else is an error.
	 */
	private void checkTrailingBytes() {
		for (int i = pos; i < buffer.length; i++) {
			if (buffer[i] != 0) {
				throw new LlsdSyntaxException("Unexpected data after binary LLSD value", i);
			}
		}
	}

	private String readText(String what) {
		int length = readLength(what);
		int start = pos;
		byte[] bytes = readBytes(length, what);
		return Utf8.decode(bytes, start);
	}

	/**
	 * Every element occupies at least one byte, so a count larger than the remaining input
	 * can be rejected before allocating anything.
	 */
	private int readCount(String what) {
		return readLength(what);
	}

	private int readLength(String what) {
		int offset = pos;
		long length = readInt() & 0xFFFF_FFFFL;
		if (length > buffer.length - pos) {
			throw new LlsdSyntaxException("Truncated input: " + what + " declares length " + length + " but only " + (buffer.length - pos) + " bytes remain", offset);
		}
		return (int) length;
	}

	private byte[] readBytes(int length, String what) {
		require(length, what);
		byte[] result = Arrays.copyOfRange(buffer, pos, pos + length);
		pos += length;
		return result;
	}

	private byte readByte() {
		require(1, "tag");
		return buffer[pos++];
	}

	private int readInt() {
		require(4, "32-bit field");
		int result = ((buffer[pos] & 0xFF) << 24)
			| ((buffer[pos + 1] & 0xFF) << 16)
			| ((buffer[pos + 2] & 0xFF) << 8)
			| (buffer[pos + 3] & 0xFF);
		pos += 4;
		return result;
	}

	private long readLong() {
		require(8, "64-bit field");
		long high = readInt() & 0xFFFF_FFFFL;
		long low = readInt() & 0xFFFF_FFFFL;
		return (high << 32) | low;
	}

	private void require(int length, String what) {
		if (buffer.length - pos < length) {
			throw new LlsdSyntaxException("Truncated input reading " + what, pos);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BinaryParser.class);
}
