package works.bosk.llsd.primitives;

import java.util.regex.Pattern;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;

/**
 * Decimal text form of 32-bit integers.
 * Out-of-range values are errors; nothing is truncated or wrapped.
 */
public final class IntegerText {
	private static final Pattern DECIMAL = Pattern.compile("[+-]?\\d+");

	private IntegerText() { }

	/**
	 * @throws LlsdPrimitiveException if {@code text} is not ASCII decimal digits with an optional sign,
	 * or does not fit in an {@code int}
	 */
	public static int parse(CharSequence text) {
		if (!DECIMAL.matcher(text).matches()) {
			throw new LlsdPrimitiveException("Invalid integer \"" + text + "\"");
		}
		try {
			return Integer.parseInt(text.toString());
		} catch (NumberFormatException e) {
			throw new LlsdPrimitiveException("Integer out of range: " + text, LlsdPrimitiveException.UNKNOWN_OFFSET, e);
		}
	}
}
