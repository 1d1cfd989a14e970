package works.bosk.llsd.codec.binary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.llsd.codec.LlsdCodec;
import works.bosk.llsd.codec.LlsdFormat;
import works.bosk.llsd.codec.LlsdSettings;
import works.bosk.llsd.value.LlsdValue;

/**
 * The compact binary LLSD format: a header line followed by one tagged value,
 * with all multi-byte fields big-endian.
 * <p>
 * This is the format exchanged with asset servers, so its tag bytes and field widths
 * are an interoperability contract, not an implementation detail.
 * <p>
 * With {@link LlsdSettings#binaryHeader()} off, the codec neither writes nor expects the header line.
 */
public final class BinaryCodec implements LlsdCodec {
	private final LlsdSettings settings;

	public BinaryCodec(LlsdSettings settings) {
		this.settings = settings;
	}

	@Override
	public LlsdValue parse(byte[] buffer) {
		LlsdValue result = new BinaryParser(buffer, settings.maxDepth()).parseDocument(settings.binaryHeader());
		LOGGER.debug("Parsed {} from {} bytes of binary LLSD", result.type(), buffer.length);
		return result;
	}

	@Override
	public byte[] serialize(LlsdValue value) {
		byte[] result = new BinaryGenerator().generateDocument(value, settings.binaryHeader());
		LOGGER.debug("Serialized {} as {} bytes of binary LLSD", value.type(), result.length);
		return result;
	}

	@Override
	public LlsdFormat format() {
		return LlsdFormat.BINARY;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BinaryCodec.class);
}
