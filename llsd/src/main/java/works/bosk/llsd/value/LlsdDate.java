package works.bosk.llsd.value;

import java.time.DateTimeException;
import java.time.Instant;

/**
 * An instant in UTC with a resolution of one second.
 *
 * @param epochSeconds seconds since 1970-01-01T00:00:00Z
 */
public record LlsdDate(long epochSeconds) implements LlsdValue {
	/**
	 * Sub-second precision is discarded by flooring to the second,
	 * so the result names the second during which {@code instant} occurs.
	 */
	public static LlsdDate of(Instant instant) {
		return new LlsdDate(instant.getEpochSecond());
	}

	/**
	 * @throws DateTimeException if {@link #epochSeconds} is outside the range of {@link Instant}
	 */
	public Instant toInstant() {
		return Instant.ofEpochSecond(epochSeconds);
	}

	@Override
	public LlsdType type() {
		return LlsdType.DATE;
	}

	@Override
	public long asDate() {
		return epochSeconds;
	}

	@Override
	public String toString() {
		return "d" + epochSeconds;
	}
}
