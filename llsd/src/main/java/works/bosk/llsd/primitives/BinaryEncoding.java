package works.bosk.llsd.primitives;

/**
 * The text encodings for binary payloads.
 * The names are those used by the {@code encoding} attribute of LLSD XML.
 */
public enum BinaryEncoding {
	BASE64("base64"),
	BASE16("base16");

	private final String attributeValue;

	BinaryEncoding(String attributeValue) {
		this.attributeValue = attributeValue;
	}

	public String attributeValue() {
		return attributeValue;
	}
}
