package works.bosk.llsd.codec;

import works.bosk.llsd.codec.notation.NotationVariant;

/**
 * The serialized forms of LLSD.
 */
public enum LlsdFormat {
	XML,
	BINARY,
	NOTATION;

	/**
	 * For {@link #NOTATION}, returns a byte-stream variant codec, which accepts every notation document.
	 */
	public LlsdCodec codec(LlsdSettings settings) {
		return switch (this) {
			case XML -> LlsdCodec.xml(settings);
			case BINARY -> LlsdCodec.binary(settings);
			case NOTATION -> LlsdCodec.notation(NotationVariant.BYTES, settings);
		};
	}
}
