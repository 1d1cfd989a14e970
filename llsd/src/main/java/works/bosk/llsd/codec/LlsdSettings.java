package works.bosk.llsd.codec;

import works.bosk.llsd.primitives.BinaryEncoding;

import static java.util.Objects.requireNonNull;

/**
 * Options for the LLSD codecs.
 *
 * @param xmlIndent spaces per nesting level in generated XML; zero puts the whole value on one line
 * @param binaryHeader whether the binary codec writes and requires the {@code <? LLSD/Binary ?>} header line
 * @param notationHeader whether the notation codec writes the {@code <? llsd/notation ?>} header line.
 *                       The parser accepts input with or without it.
 * @param notationBinaryEncoding how the notation string variant writes binary values
 * @param maxDepth the deepest nesting of arrays and maps a parser will accept
 */
public record LlsdSettings(
	int xmlIndent,
	boolean binaryHeader,
	boolean notationHeader,
	BinaryEncoding notationBinaryEncoding,
	int maxDepth
) {
	public static final LlsdSettings DEFAULT = new LlsdSettings(0, true, false, BinaryEncoding.BASE64, 512);

	public LlsdSettings {
		requireNonNull(notationBinaryEncoding);
		if (xmlIndent < 0) {
			throw new IllegalArgumentException("xmlIndent must be non-negative: " + xmlIndent);
		}
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
	}

	public LlsdSettings withXmlIndent(int xmlIndent) {
		return new LlsdSettings(xmlIndent, binaryHeader, notationHeader, notationBinaryEncoding, maxDepth);
	}

	public LlsdSettings withBinaryHeader(boolean binaryHeader) {
		return new LlsdSettings(xmlIndent, binaryHeader, notationHeader, notationBinaryEncoding, maxDepth);
	}

	public LlsdSettings withNotationHeader(boolean notationHeader) {
		return new LlsdSettings(xmlIndent, binaryHeader, notationHeader, notationBinaryEncoding, maxDepth);
	}

	public LlsdSettings withNotationBinaryEncoding(BinaryEncoding notationBinaryEncoding) {
		return new LlsdSettings(xmlIndent, binaryHeader, notationHeader, notationBinaryEncoding, maxDepth);
	}

	public LlsdSettings withMaxDepth(int maxDepth) {
		return new LlsdSettings(xmlIndent, binaryHeader, notationHeader, notationBinaryEncoding, maxDepth);
	}
}
