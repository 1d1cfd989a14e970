package works.bosk.llsd.primitives;

import java.util.Locale;
import java.util.regex.Pattern;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;

/**
 * Text forms of real numbers shared by the textual codecs.
 * <p>
 * {@link Double#parseDouble} accepts far more than LLSD does
 * (hex floats, type suffixes, {@code Infinity}),
 * so input is first checked against the decimal grammar here.
 */
public final class RealText {
	private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

	private RealText() { }

	/**
	 * @return shortest text that parses back to exactly {@code value}; only meaningful for finite values
	 */
	public static String formatFinite(double value) {
		assert Double.isFinite(value);
		return Double.toString(value);
	}

	/**
	 * The XML dialect spells the non-finite values {@code nan}, {@code inf} and {@code -inf}.
	 */
	public static String formatXml(double value) {
		if (Double.isNaN(value)) {
			return "nan";
		} else if (value == Double.POSITIVE_INFINITY) {
			return "inf";
		} else if (value == Double.NEGATIVE_INFINITY) {
			return "-inf";
		} else {
			return formatFinite(value);
		}
	}

	public static boolean isDecimal(CharSequence text) {
		return DECIMAL.matcher(text).matches();
	}

	/**
	 * @return the value of a decimal literal; may be infinite if the literal overflows
	 * @throws LlsdPrimitiveException if {@code text} does not match the decimal grammar
	 */
	public static double parseDecimal(CharSequence text) {
		if (!isDecimal(text)) {
			throw new LlsdPrimitiveException("Invalid real \"" + text + "\"");
		}
		return Double.parseDouble(text.toString());
	}

	/**
	 * Like {@link #parseDecimal}, but also accepts the non-finite spellings, case-insensitively.
	 */
	public static double parseXml(String text) {
		return switch (text.toLowerCase(Locale.ROOT)) {
			case "nan", "+nan", "-nan" -> Double.NaN;
			case "inf", "+inf", "infinity", "+infinity" -> Double.POSITIVE_INFINITY;
			case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
			default -> parseDecimal(text);
		};
	}
}
