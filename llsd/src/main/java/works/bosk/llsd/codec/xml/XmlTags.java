package works.bosk.llsd.codec.xml;

import works.bosk.llsd.value.LlsdType;

/**
 * Element and attribute names of the LLSD XML dialect.
 */
final class XmlTags {
	static final String ROOT = "llsd";
	static final String KEY = "key";
	static final String ENCODING = "encoding";

	static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

	private XmlTags() { }

	static String elementFor(LlsdType type) {
		return switch (type) {
			case UNDEFINED -> "undef";
			case BOOLEAN -> "boolean";
			case INTEGER -> "integer";
			case REAL -> "real";
			case UUID -> "uuid";
			case STRING -> "string";
			case DATE -> "date";
			case URI -> "uri";
			case BINARY -> "binary";
			case ARRAY -> "array";
			case MAP -> "map";
		};
	}

	/**
	 * @return the type for an element name, or null if the name is not an LLSD type
	 */
	static LlsdType typeFor(String elementName) {
		return switch (elementName) {
			case "undef" -> LlsdType.UNDEFINED;
			case "boolean" -> LlsdType.BOOLEAN;
			case "integer" -> LlsdType.INTEGER;
			case "real" -> LlsdType.REAL;
			case "uuid" -> LlsdType.UUID;
			case "string" -> LlsdType.STRING;
			case "date" -> LlsdType.DATE;
			case "uri" -> LlsdType.URI;
			case "binary" -> LlsdType.BINARY;
			case "array" -> LlsdType.ARRAY;
			case "map" -> LlsdType.MAP;
			default -> null;
		};
	}
}
