package works.bosk.llsd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.llsd.codec.LlsdCodec;
import works.bosk.llsd.codec.LlsdFormat;
import works.bosk.llsd.codec.LlsdSettings;
import works.bosk.llsd.exceptions.LlsdException;
import works.bosk.llsd.exceptions.LlsdUnknownTypeException;
import works.bosk.llsd.value.LlsdValue;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Entry point for documents whose format is not known in advance.
 */
public final class Llsd {
	private static final byte[] BINARY_HEADER = "<? LLSD/Binary ?>".getBytes(US_ASCII);
	private static final byte[] NOTATION_HEADER = "<? llsd/notation ?>".getBytes(US_ASCII);
	private static final byte[] XML_DECLARATION = "<?xml".getBytes(US_ASCII);
	private static final byte[] XML_ROOT = "<llsd".getBytes(US_ASCII);
	private static final byte[] UTF8_BOM = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };
	private static final String NOTATION_STARTS = "!10tfTFirusldb\"'";

	private Llsd() { }

	/**
	 * @throws LlsdUnknownTypeException if {@code buffer} does not look like any LLSD format
	 */
	public static LlsdFormat detectFormat(byte[] buffer) {
		if (startsWith(buffer, 0, BINARY_HEADER)) {
			return LlsdFormat.BINARY;
		}
		int start = startsWith(buffer, 0, UTF8_BOM) ? UTF8_BOM.length : 0;
		while (start < buffer.length && isWhitespace(buffer[start])) {
			start++;
		}
		if (startsWith(buffer, start, NOTATION_HEADER)) {
			return LlsdFormat.NOTATION;
		} else if (startsWith(buffer, start, XML_DECLARATION) || startsWith(buffer, start, XML_ROOT)) {
			return LlsdFormat.XML;
		} else if (start >= buffer.length) {
			throw new LlsdUnknownTypeException("Empty LLSD document", start);
		}
		byte first = buffer[start];
		if (first == '[' || first == '{') {
			// Binary arrays and maps begin with a 4-byte count whose high byte is
			// zero for any realistic size; notation never has a NUL there.
			if (start == 0 && buffer.length > 1 && buffer[1] == 0) {
				return LlsdFormat.BINARY;
			}
			return LlsdFormat.NOTATION;
		} else if (NOTATION_STARTS.indexOf(first) >= 0) {
			return LlsdFormat.NOTATION;
		} else {
			throw new LlsdUnknownTypeException("Unrecognized LLSD document", start);
		}
	}

	/**
	 * @throws LlsdException if the format can't be detected or the document is invalid
	 */
	public static LlsdValue parse(byte[] buffer) {
		return parse(buffer, LlsdSettings.DEFAULT);
	}

	/**
	 * Detects the format and parses with the matching codec.
	 * A binary document without its header line is accepted regardless of
	 * {@link LlsdSettings#binaryHeader()}.
	 *
	 * @throws LlsdException if the format can't be detected or the document is invalid
	 */
	public static LlsdValue parse(byte[] buffer, LlsdSettings settings) {
		LlsdFormat format = detectFormat(buffer);
		LlsdCodec codec;
		if (format == LlsdFormat.BINARY) {
			boolean hasHeader = startsWith(buffer, 0, BINARY_HEADER);
			codec = format.codec(settings.withBinaryHeader(hasHeader));
		} else {
			codec = format.codec(settings);
		}
		LOGGER.debug("Detected {} in {} bytes", format, buffer.length);
		return codec.parse(buffer);
	}

	private static boolean startsWith(byte[] buffer, int offset, byte[] prefix) {
		if (buffer.length - offset < prefix.length) {
			return false;
		}
		for (int i = 0; i < prefix.length; i++) {
			if (buffer[offset + i] != prefix[i]) {
				return false;
			}
		}
		return true;
	}

	private static boolean isWhitespace(byte b) {
		return b == ' ' || b == '\t' || b == '\r' || b == '\n';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Llsd.class);
}
