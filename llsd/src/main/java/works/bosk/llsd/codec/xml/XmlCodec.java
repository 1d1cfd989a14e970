package works.bosk.llsd.codec.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.llsd.codec.LlsdCodec;
import works.bosk.llsd.codec.LlsdFormat;
import works.bosk.llsd.codec.LlsdSettings;
import works.bosk.llsd.value.LlsdValue;

/**
 * The LLSD XML dialect: an {@code <llsd>} root element holding one value element.
 * <p>
 * Output uses UTF-8 and is compact unless {@link LlsdSettings#xmlIndent()} is set.
 * Binary values are always written in base64; base16 is also accepted on input.
 */
public final class XmlCodec implements LlsdCodec {
	private final LlsdSettings settings;

	public XmlCodec(LlsdSettings settings) {
		this.settings = settings;
	}

	@Override
	public LlsdValue parse(byte[] buffer) {
		LlsdValue result = XmlParser.read(buffer, settings.maxDepth()).parseDocument();
		LOGGER.debug("Parsed {} from {} bytes of XML", result.type(), buffer.length);
		return result;
	}

	@Override
	public byte[] serialize(LlsdValue value) {
		byte[] result = new XmlGenerator(settings.xmlIndent()).generateDocument(value);
		LOGGER.debug("Serialized {} as {} bytes of XML", value.type(), result.length);
		return result;
	}

	@Override
	public LlsdFormat format() {
		return LlsdFormat.XML;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(XmlCodec.class);
}
