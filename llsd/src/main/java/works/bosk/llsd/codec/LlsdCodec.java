package works.bosk.llsd.codec;

import works.bosk.llsd.codec.binary.BinaryCodec;
import works.bosk.llsd.codec.notation.NotationCodec;
import works.bosk.llsd.codec.notation.NotationVariant;
import works.bosk.llsd.codec.xml.XmlCodec;
import works.bosk.llsd.exceptions.LlsdException;
import works.bosk.llsd.value.LlsdValue;

/**
 * Converts between {@link LlsdValue} trees and one serialized LLSD format.
 * <p>
 * Implementations are immutable and thread-safe.
 * Each call works on a complete in-memory document
 * and either returns a complete result or throws a single {@link LlsdException}.
 */
public interface LlsdCodec {
	/**
	 * @throws LlsdException if {@code buffer} is not a valid document in this format
	 */
	LlsdValue parse(byte[] buffer);

	/**
	 * @throws LlsdException if {@code value} cannot be represented in this format
	 */
	byte[] serialize(LlsdValue value);

	LlsdFormat format();

	static LlsdCodec xml() {
		return new XmlCodec(LlsdSettings.DEFAULT);
	}

	static LlsdCodec binary() {
		return new BinaryCodec(LlsdSettings.DEFAULT);
	}

	static LlsdCodec notation(NotationVariant variant) {
		return new NotationCodec(variant, LlsdSettings.DEFAULT);
	}

	static LlsdCodec xml(LlsdSettings settings) {
		return new XmlCodec(settings);
	}

	static LlsdCodec binary(LlsdSettings settings) {
		return new BinaryCodec(settings);
	}

	static LlsdCodec notation(NotationVariant variant, LlsdSettings settings) {
		return new NotationCodec(variant, settings);
	}
}
