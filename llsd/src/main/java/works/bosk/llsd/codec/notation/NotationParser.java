package works.bosk.llsd.codec.notation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.IntPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;
import works.bosk.llsd.exceptions.LlsdSyntaxException;
import works.bosk.llsd.exceptions.LlsdUnknownTypeException;
import works.bosk.llsd.exceptions.LlsdUnsupportedValueException;
import works.bosk.llsd.primitives.BinaryEncoding;
import works.bosk.llsd.primitives.BinaryText;
import works.bosk.llsd.primitives.DateText;
import works.bosk.llsd.primitives.IntegerText;
import works.bosk.llsd.primitives.RealText;
import works.bosk.llsd.primitives.UuidText;
import works.bosk.llsd.primitives.Utf8;
import works.bosk.llsd.value.LlsdMap;
import works.bosk.llsd.value.LlsdValue;

import static works.bosk.llsd.codec.notation.NotationReader.END;
import static works.bosk.llsd.codec.notation.NotationSyntax.describe;
import static works.bosk.llsd.codec.notation.NotationSyntax.isQuote;

/**
 * Recursive-descent parser for one notation document.
 * Works identically over either {@link NotationReader}; the reader decides whether
 * byte-counted spans are acceptable.
 */
final class NotationParser {
	private final NotationReader in;
	private final int maxDepth;
	private int depth = 0;

	NotationParser(NotationReader in, int maxDepth) {
		this.in = in;
		this.maxDepth = maxDepth;
	}

	LlsdValue parseDocument() {
		in.skipWhitespace();
		if (in.consumeIf(NotationSyntax.HEADER)) {
			LOGGER.trace("Skipped notation header");
		}
		LlsdValue result = parseValue();
		in.skipWhitespace();
		if (in.peek() != END) {
			throw new LlsdSyntaxException("Unexpected data after notation value: \"" + in.preview(10) + "\"", in.offset());
		}
		return result;
	}

	private LlsdValue parseValue() {
		in.skipWhitespace();
		long offset = in.offset();
		int c = in.next();
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} @ {}", describe(c), offset);
		}
		try {
			return switch (c) {
				case END -> throw new LlsdSyntaxException("Unexpected end of input; expected a value", offset);
				case NotationSyntax.UNDEFINED -> LlsdValue.undefined();
				case '1' -> LlsdValue.of(true);
				case '0' -> LlsdValue.of(false);
				case 't', 'T', 'f', 'F' -> parseBooleanWord(c);
				case NotationSyntax.INTEGER -> LlsdValue.of(IntegerText.parse(readWhile(NotationParser::isNumberChar)));
				case NotationSyntax.REAL -> parseReal(offset);
				case NotationSyntax.UUID -> LlsdValue.of(UuidText.parse(readFixed(UuidText.TEXT_LENGTH, "UUID")));
				case '"', '\'' -> LlsdValue.of(in.readQuoted(c));
				case NotationSyntax.COUNTED_STRING -> LlsdValue.of(readCountedString(offset));
				case NotationSyntax.URI -> LlsdValue.uri(readQuotedAfterPrefix("URI"));
				case NotationSyntax.DATE -> LlsdValue.date(DateText.parse(readQuotedAfterPrefix("date")));
				case NotationSyntax.BINARY -> parseBinary(offset);
				case NotationSyntax.ARRAY_OPEN -> parseArray(offset);
				case NotationSyntax.MAP_OPEN -> parseMap(offset);
				default -> throw new LlsdUnknownTypeException("Unknown notation value starting with " + describe(c), offset);
			};
		} catch (LlsdPrimitiveException e) {
			throw e.at(offset);
		}
	}

	private LlsdValue parseBooleanWord(int first) {
		String word = (char) first + readWhile(NotationParser::isAsciiLetter);
		switch (word) {
			case "t", "T", "true", "TRUE":
				return LlsdValue.of(true);
			case "f", "F", "false", "FALSE":
				return LlsdValue.of(false);
			default:
				throw new LlsdPrimitiveException("Invalid boolean \"" + word + "\"");
		}
	}

	private LlsdValue parseReal(long offset) {
		int sign = (in.peek() == '+' || in.peek() == '-') ? 1 : 0;
		if (isAsciiLetter(in.peek(sign))) {
			String word = readWhile(c -> c == '+' || c == '-' || isAsciiLetter(c));
			String magnitude = word.substring(sign).toLowerCase(Locale.ROOT);
			if (magnitude.equals("nan") || magnitude.equals("inf") || magnitude.equals("infinity")) {
				throw new LlsdUnsupportedValueException("Notation cannot represent non-finite real \"" + word + "\"", offset);
			}
			throw new LlsdPrimitiveException("Invalid real \"" + word + "\"");
		}
		String text = readWhile(NotationParser::isNumberChar);
		double value = RealText.parseDecimal(text);
		if (!Double.isFinite(value)) {
			throw new LlsdUnsupportedValueException("Real \"" + text + "\" is out of range", offset);
		}
		return LlsdValue.of(value);
	}

	private LlsdValue parseBinary(long offset) {
		int c = in.next();
		if (c == NotationSyntax.COUNT_OPEN) {
			return LlsdValue.binary(readCountedBody(offset));
		} else if (c == END) {
			throw new LlsdSyntaxException("Truncated input reading binary", offset);
		}
		String base = (char) c + readWhile(NotationParser::isAsciiDigit);
		BinaryEncoding encoding;
		switch (base) {
			case "64":
				encoding = BinaryEncoding.BASE64;
				break;
			case "16":
				encoding = BinaryEncoding.BASE16;
				break;
			default:
				throw new LlsdUnsupportedValueException("Unsupported binary encoding \"b" + base + "\"", offset);
		}
		return LlsdValue.binary(BinaryText.decode(readQuotedAfterPrefix("binary"), encoding));
	}

	private String readCountedString(long offset) {
		in.expect(NotationSyntax.COUNT_OPEN, "after 's'");
		long bodyOffset = in.offset();
		byte[] bytes = readCountedBody(offset);
		return Utf8.decode(bytes, 0, bytes.length, bodyOffset);
	}

	/**
	 * Call after consuming the opening parenthesis of {@code (N)"..."}.
	 */
	private byte[] readCountedBody(long offset) {
		if (!in.supportsByteCounts()) {
			throw new LlsdUnsupportedValueException("Byte-counted spans are not allowed in notation text", offset);
		}
		long countOffset = in.offset();
		String digits = readWhile(NotationParser::isAsciiDigit);
		if (digits.isEmpty()) {
			throw new LlsdSyntaxException("Expected a byte count but found " + describe(in.peek()), countOffset);
		}
		int length;
		try {
			length = IntegerText.parse(digits);
		} catch (LlsdPrimitiveException e) {
			throw e.at(countOffset);
		}
		in.expect(NotationSyntax.COUNT_CLOSE, "after byte count");
		long quoteOffset = in.offset();
		int quote = in.next();
		if (!isQuote(quote)) {
			throw new LlsdSyntaxException("Expected a quote after byte count but found " + describe(quote), quoteOffset);
		}
		byte[] result = in.readCounted(length);
		in.expect((char) quote, "after " + length + " counted bytes");
		return result;
	}

	private String readQuotedAfterPrefix(String what) {
		long offset = in.offset();
		int quote = in.next();
		if (!isQuote(quote)) {
			throw new LlsdSyntaxException("Expected a quote to begin " + what + " but found " + describe(quote), offset);
		}
		return in.readQuoted(quote);
	}

	private String readFixed(int length, String what) {
		long offset = in.offset();
		StringBuilder sb = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			int c = in.next();
			if (c == END) {
				throw new LlsdSyntaxException("Truncated input reading " + what, offset);
			}
			sb.append((char) c);
		}
		return sb.toString();
	}

	private LlsdValue parseArray(long offset) {
		enter(offset);
		List<LlsdValue> elements = new ArrayList<>();
		in.skipWhitespace();
		if (in.peek() == NotationSyntax.ARRAY_CLOSE) {
			in.next();
		} else {
			while (true) {
				elements.add(parseValue());
				if (endOfSequence(NotationSyntax.ARRAY_CLOSE, "array", offset)) {
					break;
				}
			}
		}
		exit();
		return LlsdValue.array(elements);
	}

	private LlsdValue parseMap(long offset) {
		enter(offset);
		LlsdMap.Builder builder = LlsdMap.builder();
		in.skipWhitespace();
		if (in.peek() == NotationSyntax.MAP_CLOSE) {
			in.next();
		} else {
			while (true) {
				String key = parseKey();
				in.skipWhitespace();
				in.expect(NotationSyntax.KEY_SEPARATOR, "after map key \"" + key + "\"");
				builder.put(key, parseValue());
				if (endOfSequence(NotationSyntax.MAP_CLOSE, "map", offset)) {
					break;
				}
			}
		}
		exit();
		return builder.build();
	}

	private String parseKey() {
		in.skipWhitespace();
		long offset = in.offset();
		int c = in.next();
		if (isQuote(c)) {
			return in.readQuoted(c);
		} else if (c == NotationSyntax.COUNTED_STRING) {
			return readCountedString(offset);
		} else if (c == END) {
			throw new LlsdSyntaxException("Unterminated map", offset);
		} else {
			throw new LlsdSyntaxException("Expected a quoted map key but found " + describe(c), offset);
		}
	}

	/**
	 * Consumes the separator or terminator following an element.
	 *
	 * @return true if the container ended
	 */
	private boolean endOfSequence(char close, String what, long openOffset) {
		in.skipWhitespace();
		long offset = in.offset();
		int c = in.next();
		if (c == close) {
			return true;
		} else if (c == NotationSyntax.SEPARATOR) {
			return false;
		} else if (c == END) {
			throw new LlsdSyntaxException("Unterminated " + what + " starting at offset " + openOffset, offset);
		} else {
			throw new LlsdSyntaxException("Expected ',' or '" + close + "' in " + what + " but found " + describe(c), offset);
		}
	}

	private void enter(long offset) {
		if (++depth > maxDepth) {
			throw new LlsdSyntaxException("Nesting deeper than " + maxDepth, offset);
		}
	}

	private void exit() {
		--depth;
	}

	private String readWhile(IntPredicate accept) {
		StringBuilder sb = new StringBuilder();
		while (in.peek() != END && accept.test(in.peek())) {
			sb.append((char) in.next());
		}
		return sb.toString();
	}

	private static boolean isNumberChar(int c) {
		return isAsciiDigit(c) || c == '+' || c == '-' || c == '.' || c == 'e' || c == 'E';
	}

	private static boolean isAsciiDigit(int c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isAsciiLetter(int c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NotationParser.class);
}
