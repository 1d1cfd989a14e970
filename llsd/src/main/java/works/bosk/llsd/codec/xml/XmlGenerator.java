package works.bosk.llsd.codec.xml;

import java.util.List;
import java.util.Map;
import works.bosk.llsd.exceptions.LlsdUnsupportedValueException;
import works.bosk.llsd.primitives.BinaryEncoding;
import works.bosk.llsd.primitives.BinaryText;
import works.bosk.llsd.primitives.DateText;
import works.bosk.llsd.primitives.RealText;
import works.bosk.llsd.primitives.UuidText;
import works.bosk.llsd.primitives.Utf8;
import works.bosk.llsd.value.LlsdValue;

/**
 * Writes one LLSD XML document.
 * Each instance accumulates one document.
 */
final class XmlGenerator {
	private final StringBuilder sb = new StringBuilder();
	private final int indent;

	XmlGenerator(int indent) {
		this.indent = indent;
	}

	byte[] generateDocument(LlsdValue value) {
		sb.append(XmlTags.DECLARATION).append('\n');
		sb.append('<').append(XmlTags.ROOT).append('>');
		generate(value, 0);
		if (indent > 0) {
			sb.append('\n');
		}
		sb.append("</").append(XmlTags.ROOT).append(">\n");
		return Utf8.encode(sb);
	}

	private void generate(LlsdValue value, int level) {
		newline(level);
		String element = XmlTags.elementFor(value.type());
		switch (value.type()) {
			case UNDEFINED -> scalar(element, "");
			case BOOLEAN -> scalar(element, value.asBoolean() ? "true" : "false");
			case INTEGER -> scalar(element, Integer.toString(value.asInteger()));
			case REAL -> scalar(element, RealText.formatXml(value.asReal()));
			case UUID -> scalar(element, UuidText.format(value.asUuid()));
			case STRING -> scalar(element, value.asString());
			case DATE -> scalar(element, DateText.format(value.asDate()));
			case URI -> scalar(element, value.asUri());
			case BINARY -> {
				String text = BinaryText.encode(value.asBinary(), BinaryEncoding.BASE64);
				String start = element + " " + XmlTags.ENCODING + "=\"" + BinaryEncoding.BASE64.attributeValue() + "\"";
				if (text.isEmpty()) {
					sb.append('<').append(start).append(" />");
				} else {
					sb.append('<').append(start).append('>').append(text);
					sb.append("</").append(element).append('>');
				}
			}
			case ARRAY -> {
				List<LlsdValue> elements = value.asArray();
				if (elements.isEmpty()) {
					sb.append('<').append(element).append(" />");
				} else {
					sb.append('<').append(element).append('>');
					elements.forEach(e -> generate(e, level + 1));
					newline(level);
					sb.append("</").append(element).append('>');
				}
			}
			case MAP -> {
				Map<String, LlsdValue> entries = value.asMap();
				if (entries.isEmpty()) {
					sb.append('<').append(element).append(" />");
				} else {
					sb.append('<').append(element).append('>');
					entries.forEach((key, member) -> {
						newline(level + 1);
						scalar(XmlTags.KEY, key);
						generate(member, level + 1);
					});
					newline(level);
					sb.append("</").append(element).append('>');
				}
			}
		}
	}

	private void scalar(String element, String text) {
		if (text.isEmpty()) {
			sb.append('<').append(element).append(" />");
		} else {
			sb.append('<').append(element).append('>');
			appendEscaped(text);
			sb.append("</").append(element).append('>');
		}
	}

	private void newline(int level) {
		if (indent > 0) {
			sb.append('\n');
			sb.append(" ".repeat(level * indent));
		}
	}

	/**
	 * A carriage return is written as a character reference because
	 * XML parsers normalize literal line endings to a single line feed.
	 */
	private void appendEscaped(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '<' -> sb.append("&lt;");
				case '>' -> sb.append("&gt;");
				case '&' -> sb.append("&amp;");
				case '"' -> sb.append("&quot;");
				case '\'' -> sb.append("&apos;");
				case '\r' -> sb.append("&#13;");
				default -> {
					if (!isXmlChar(c)) {
						throw new LlsdUnsupportedValueException(String.format("Character U+%04X cannot appear in XML", (int) c));
					}
					sb.append(c);
				}
			}
		}
	}

	/**
	 * Surrogates are allowed through here; {@link Utf8#encode} rejects unpaired ones.
	 */
	private static boolean isXmlChar(char c) {
		return c >= 0x20 ? (c != 0xFFFE && c != 0xFFFF) : (c == '\t' || c == '\n');
	}
}
