package works.bosk.llsd.primitives;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;
import works.bosk.llsd.exceptions.LlsdUnsupportedValueException;

import static java.time.ZoneOffset.UTC;
import static java.time.format.DateTimeFormatter.ISO_INSTANT;
import static java.time.format.DateTimeFormatter.ISO_OFFSET_DATE_TIME;

/**
 * Conversions between epoch seconds and ISO-8601 timestamps.
 * <p>
 * Output is always UTC with whole seconds, like {@code 2006-02-01T14:29:53Z}.
 * Input may carry any UTC offset and fractional seconds;
 * the fraction is discarded by flooring to the second in which the instant falls.
 * <p>
 * Both directions cover years -999,999,999 through 999,999,999, the range of {@link OffsetDateTime}.
 */
public final class DateText {
	public static final long MIN_EPOCH_SECONDS = LocalDateTime.MIN.toEpochSecond(UTC);
	public static final long MAX_EPOCH_SECONDS = LocalDateTime.MAX.toEpochSecond(UTC);

	private DateText() { }

	/**
	 * @throws LlsdUnsupportedValueException if the date is outside the range this class can parse back
	 */
	public static String format(long epochSeconds) {
		if (!inRange(epochSeconds)) {
			throw new LlsdUnsupportedValueException("Date " + epochSeconds + " has no ISO-8601 text form");
		}
		return ISO_INSTANT.format(Instant.ofEpochSecond(epochSeconds));
	}

	/**
	 * @throws LlsdPrimitiveException if the text is not an ISO-8601 date-time with an offset,
	 * or denotes an instant outside the range {@link #format} accepts
	 */
	public static long parse(CharSequence text) {
		long result;
		try {
			result = ISO_OFFSET_DATE_TIME.parse(text, OffsetDateTime::from).toEpochSecond();
		} catch (DateTimeParseException e) {
			throw new LlsdPrimitiveException("Invalid date \"" + text + "\"", LlsdPrimitiveException.UNKNOWN_OFFSET, e);
		}
		if (!inRange(result)) {
			throw new LlsdPrimitiveException("Date out of range: \"" + text + "\"");
		}
		return result;
	}

	private static boolean inRange(long epochSeconds) {
		return MIN_EPOCH_SECONDS <= epochSeconds && epochSeconds <= MAX_EPOCH_SECONDS;
	}
}
