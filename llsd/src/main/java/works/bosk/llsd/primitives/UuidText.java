package works.bosk.llsd.primitives;

import java.nio.ByteBuffer;
import java.util.UUID;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;

/**
 * Conversions between {@link UUID} and its LLSD text and byte forms.
 * <p>
 * The text form is 32 lowercase hex digits grouped 8-4-4-4-12 with hyphens.
 * The byte form is the 16 bytes of the UUID, most significant first.
 */
public final class UuidText {
	public static final UUID NIL = new UUID(0L, 0L);
	public static final int TEXT_LENGTH = 36;
	public static final int BYTE_LENGTH = 16;

	private UuidText() { }

	public static String format(UUID uuid) {
		// UUID.toString already produces the canonical lowercase grouping
		return uuid.toString();
	}

	/**
	 * Stricter than {@link UUID#fromString}, which accepts groups of the wrong length.
	 *
	 * @throws LlsdPrimitiveException if {@code text} is not exactly in canonical grouping
	 */
	public static UUID parse(CharSequence text) {
		if (text.length() != TEXT_LENGTH) {
			throw new LlsdPrimitiveException("Invalid UUID \"" + text + "\": expected " + TEXT_LENGTH + " characters");
		}
		long msb = 0;
		long lsb = 0;
		int digits = 0;
		for (int i = 0; i < TEXT_LENGTH; i++) {
			char c = text.charAt(i);
			if (i == 8 || i == 13 || i == 18 || i == 23) {
				if (c != '-') {
					throw new LlsdPrimitiveException("Invalid UUID \"" + text + "\": expected '-' at position " + i);
				}
				continue;
			}
			int nibble = Character.digit(c, 16);
			if (nibble < 0 || c > 'f') {
				throw new LlsdPrimitiveException("Invalid UUID \"" + text + "\": '" + c + "' is not a hex digit");
			}
			if (digits < 16) {
				msb = (msb << 4) | nibble;
			} else {
				lsb = (lsb << 4) | nibble;
			}
			digits++;
		}
		return new UUID(msb, lsb);
	}

	public static byte[] toBytes(UUID uuid) {
		return ByteBuffer.allocate(BYTE_LENGTH)
			.putLong(uuid.getMostSignificantBits())
			.putLong(uuid.getLeastSignificantBits())
			.array();
	}

	public static UUID fromBytes(byte[] bytes, int offset) {
		ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, BYTE_LENGTH);
		return new UUID(buffer.getLong(), buffer.getLong());
	}
}
