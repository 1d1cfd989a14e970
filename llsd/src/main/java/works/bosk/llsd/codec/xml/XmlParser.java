package works.bosk.llsd.codec.xml;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;
import works.bosk.llsd.exceptions.LlsdSyntaxException;
import works.bosk.llsd.exceptions.LlsdUnknownTypeException;
import works.bosk.llsd.primitives.BinaryText;
import works.bosk.llsd.primitives.DateText;
import works.bosk.llsd.primitives.IntegerText;
import works.bosk.llsd.primitives.RealText;
import works.bosk.llsd.primitives.UuidText;
import works.bosk.llsd.value.LlsdMap;
import works.bosk.llsd.value.LlsdType;
import works.bosk.llsd.value.LlsdValue;

import static javax.xml.stream.XMLStreamConstants.CDATA;
import static javax.xml.stream.XMLStreamConstants.CHARACTERS;
import static javax.xml.stream.XMLStreamConstants.END_ELEMENT;
import static javax.xml.stream.XMLStreamConstants.ENTITY_REFERENCE;
import static javax.xml.stream.XMLStreamConstants.SPACE;
import static javax.xml.stream.XMLStreamConstants.START_ELEMENT;

/**
 * Decodes one LLSD XML document in two passes.
 * <p>
 * The first pass runs the whole input through StAX, so a well-formedness error anywhere
 * in the document is reported before any value is built.
 * It keeps only elements and text; comments and processing instructions are dropped.
 * The second pass walks those events top-down to build the value tree.
 */
final class XmlParser {
	private final List<Event> events;
	private final int maxDepth;
	private int index = 0;
	private int depth = 0;

	private XmlParser(List<Event> events, int maxDepth) {
		this.events = events;
		this.maxDepth = maxDepth;
	}

	/**
	 * A start tag, end tag, or run of text.
	 * For start tags, {@code encoding} holds the value of that attribute, if any.
	 */
	record Event(int kind, String name, String text, String encoding, long offset) {
		boolean isStart() {
			return kind == START_ELEMENT;
		}

		boolean isEnd() {
			return kind == END_ELEMENT;
		}

		boolean isText() {
			return kind == CHARACTERS;
		}
	}

	static XmlParser read(byte[] buffer, int maxDepth) {
		XMLInputFactory factory = XMLInputFactory.newFactory();
		factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
		factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
		factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
		factory.setProperty(XMLInputFactory.IS_COALESCING, true);

		List<Event> events = new ArrayList<>();
		XMLStreamReader reader = null;
		try {
			reader = factory.createXMLStreamReader(new ByteArrayInputStream(buffer));
			while (reader.hasNext()) {
				int kind = reader.next();
				long offset = offsetOf(reader.getLocation());
				switch (kind) {
					case START_ELEMENT -> events.add(new Event(START_ELEMENT, reader.getLocalName(), null, reader.getAttributeValue(null, XmlTags.ENCODING), offset));
					case END_ELEMENT -> events.add(new Event(END_ELEMENT, reader.getLocalName(), null, null, offset));
					case CHARACTERS, CDATA, SPACE -> events.add(new Event(CHARACTERS, null, reader.getText(), null, offset));
					case ENTITY_REFERENCE -> throw new LlsdSyntaxException("Unresolved entity reference &" + reader.getLocalName() + ";", offset);
					default -> { }
				}
			}
		} catch (XMLStreamException e) {
			throw new LlsdSyntaxException("Malformed XML: " + e.getMessage(), offsetOf(e.getLocation()), e);
		} finally {
			closeQuietly(reader);
		}
		LOGGER.trace("Read {} XML events", events.size());
		return new XmlParser(events, maxDepth);
	}

	LlsdValue parseDocument() {
		Event root = nextSignificant("<" + XmlTags.ROOT + ">");
		if (!root.isStart() || !XmlTags.ROOT.equals(root.name())) {
			throw new LlsdSyntaxException("Expected <" + XmlTags.ROOT + "> root element but found " + describe(root), root.offset());
		}
		Event first = nextSignificant("LLSD value");
		if (first.isEnd()) {
			throw new LlsdSyntaxException("<" + XmlTags.ROOT + "> contains no value", first.offset());
		}
		LlsdValue result = parseValue(first);
		Event last = nextSignificant("</" + XmlTags.ROOT + ">");
		if (!last.isEnd()) {
			throw new LlsdSyntaxException("<" + XmlTags.ROOT + "> contains more than one value", last.offset());
		}
		return result;
	}

	private LlsdValue parseValue(Event start) {
		LlsdType type = XmlTags.typeFor(start.name());
		if (type == null) {
			throw new LlsdUnknownTypeException("Unknown LLSD element <" + start.name() + ">", start.offset());
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("<{}> @ {}", start.name(), start.offset());
		}
		try {
			return switch (type) {
				case UNDEFINED -> {
					if (!readText(start).isBlank()) {
						throw new LlsdSyntaxException("<undef> must be empty", start.offset());
					}
					yield LlsdValue.undefined();
				}
				case BOOLEAN -> LlsdValue.of(parseBoolean(readText(start).trim()));
				case INTEGER -> {
					String text = readText(start).trim();
					yield LlsdValue.of(text.isEmpty() ? 0 : IntegerText.parse(text));
				}
				case REAL -> {
					String text = readText(start).trim();
					yield LlsdValue.of(text.isEmpty() ? 0.0 : RealText.parseXml(text));
				}
				case UUID -> {
					String text = readText(start).trim();
					yield LlsdValue.of(text.isEmpty() ? UuidText.NIL : UuidText.parse(text));
				}
				case STRING -> LlsdValue.of(readText(start));
				case DATE -> {
					String text = readText(start).trim();
					yield LlsdValue.date(text.isEmpty() ? 0L : DateText.parse(text));
				}
				case URI -> LlsdValue.uri(readText(start));
				case BINARY -> {
					String encoding = (start.encoding() == null) ? "base64" : start.encoding();
					yield LlsdValue.binary(BinaryText.decode(readText(start), BinaryText.encodingNamed(encoding)));
				}
				case ARRAY -> parseArray(start);
				case MAP -> parseMap(start);
			};
		} catch (LlsdPrimitiveException e) {
			throw e.at(start.offset());
		}
	}

	private LlsdValue parseArray(Event start) {
		enter(start);
		List<LlsdValue> elements = new ArrayList<>();
		Event next;
		while (!(next = nextSignificant("</array>")).isEnd()) {
			elements.add(parseValue(next));
		}
		exit();
		return LlsdValue.array(elements);
	}

	private LlsdValue parseMap(Event start) {
		enter(start);
		LlsdMap.Builder builder = LlsdMap.builder();
		Event next;
		while (!(next = nextSignificant("</map>")).isEnd()) {
			if (!XmlTags.KEY.equals(next.name())) {
				throw new LlsdSyntaxException("Expected <" + XmlTags.KEY + "> in map but found " + describe(next), next.offset());
			}
			String key = readText(next);
			Event value = nextSignificant("value for key \"" + key + "\"");
			if (value.isEnd() || XmlTags.KEY.equals(value.name())) {
				throw new LlsdSyntaxException("Map key \"" + key + "\" has no value", value.offset());
			}
			builder.put(key, parseValue(value));
		}
		exit();
		return builder.build();
	}

	/**
	 * Consumes the text content of a scalar element and its end tag.
	 */
	private String readText(Event start) {
		StringBuilder sb = new StringBuilder();
		while (index < events.size()) {
			Event event = events.get(index++);
			if (event.isText()) {
				sb.append(event.text());
			} else if (event.isEnd()) {
				return sb.toString();
			} else {
				throw new LlsdSyntaxException("<" + start.name() + "> may not contain " + describe(event), event.offset());
			}
		}
		throw new LlsdSyntaxException("Unexpected end of document inside <" + start.name() + ">", start.offset());
	}

	/**
	 * @return the next start or end tag, skipping whitespace
	 */
	private Event nextSignificant(String expected) {
		while (index < events.size()) {
			Event event = events.get(index++);
			if (!event.isText()) {
				return event;
			} else if (!event.text().isBlank()) {
				throw new LlsdSyntaxException("Unexpected text \"" + event.text().strip() + "\"; expected " + expected, event.offset());
			}
		}
		throw new LlsdSyntaxException("Unexpected end of document; expected " + expected, LlsdSyntaxException.UNKNOWN_OFFSET);
	}

	private void enter(Event start) {
		if (++depth > maxDepth) {
			throw new LlsdSyntaxException("Nesting deeper than " + maxDepth, start.offset());
		}
	}

	private void exit() {
		--depth;
	}

	/**
	 * Accepts the loose forms that LSL scripts produce: {@code 1} and {@code 0},
	 * and an empty element meaning false.
	 */
	private static boolean parseBoolean(String text) {
		return switch (text) {
			case "true", "1", "1.0" -> true;
			case "false", "0", "0.0", "" -> false;
			default -> throw new LlsdPrimitiveException("Invalid boolean \"" + text + "\"");
		};
	}

	private static String describe(Event event) {
		if (event.isStart()) {
			return "<" + event.name() + ">";
		} else if (event.isEnd()) {
			return "</" + event.name() + ">";
		} else {
			return "text";
		}
	}

	private static long offsetOf(Location location) {
		if (location == null || location.getCharacterOffset() < 0) {
			return LlsdSyntaxException.UNKNOWN_OFFSET;
		} else {
			return location.getCharacterOffset();
		}
	}

	private static void closeQuietly(XMLStreamReader reader) {
		if (reader != null) {
			try {
				reader.close();
			} catch (XMLStreamException e) {
				LOGGER.debug("Ignoring failure to close XML reader", e);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(XmlParser.class);
}
