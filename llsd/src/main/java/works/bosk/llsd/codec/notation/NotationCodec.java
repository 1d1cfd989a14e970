package works.bosk.llsd.codec.notation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.llsd.codec.LlsdCodec;
import works.bosk.llsd.codec.LlsdFormat;
import works.bosk.llsd.codec.LlsdSettings;
import works.bosk.llsd.primitives.Utf8;
import works.bosk.llsd.value.LlsdValue;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The human-readable LLSD notation, such as {@code {'name':"Ann",'age':i30}}.
 * <p>
 * The {@link NotationVariant} decides whether byte-counted spans are read and written.
 * The optional {@code <? llsd/notation ?>} header is always accepted, and is written
 * when {@link LlsdSettings#notationHeader()} is set.
 */
public final class NotationCodec implements LlsdCodec {
	private final NotationVariant variant;
	private final LlsdSettings settings;

	public NotationCodec(NotationVariant variant, LlsdSettings settings) {
		this.variant = variant;
		this.settings = settings;
	}

	public NotationVariant variant() {
		return variant;
	}

	@Override
	public LlsdValue parse(byte[] buffer) {
		NotationReader reader = switch (variant) {
			case BYTES -> new ByteArrayNotationReader(buffer);
			case STRING -> new CharArrayNotationReader(Utf8.decode(buffer, 0));
		};
		LlsdValue result = new NotationParser(reader, settings.maxDepth()).parseDocument();
		LOGGER.debug("Parsed {} from {} bytes of {} notation", result.type(), buffer.length, variant);
		return result;
	}

	/**
	 * Parses notation held as text, which admits only the {@link NotationVariant#STRING string} rules
	 * regardless of this codec's variant.
	 */
	public LlsdValue parse(String text) {
		LlsdValue result = new NotationParser(new CharArrayNotationReader(text), settings.maxDepth()).parseDocument();
		LOGGER.debug("Parsed {} from {} chars of notation", result.type(), text.length());
		return result;
	}

	@Override
	public byte[] serialize(LlsdValue value) {
		byte[] result = new NotationGenerator(variant, settings.notationBinaryEncoding())
			.generateDocument(value, settings.notationHeader());
		LOGGER.debug("Serialized {} as {} bytes of {} notation", value.type(), result.length, variant);
		return result;
	}

	/**
	 * Serializes with the {@link NotationVariant#STRING string} rules regardless of this codec's variant,
	 * since byte-counted binary cannot be carried in a {@link String}.
	 */
	public String serializeToString(LlsdValue value) {
		byte[] bytes = new NotationGenerator(NotationVariant.STRING, settings.notationBinaryEncoding())
			.generateDocument(value, settings.notationHeader());
		return new String(bytes, UTF_8);
	}

	@Override
	public LlsdFormat format() {
		return LlsdFormat.NOTATION;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NotationCodec.class);
}
