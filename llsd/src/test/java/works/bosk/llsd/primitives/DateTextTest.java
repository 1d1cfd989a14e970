package works.bosk.llsd.primitives;

import java.time.Instant;
import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;
import works.bosk.llsd.exceptions.LlsdUnsupportedValueException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DateTextTest {
	static final long SAMPLE = 1138804193L;

	@Test
	void formatsUtcWholeSeconds() {
		assertEquals("2006-02-01T14:29:53Z", DateText.format(SAMPLE));
		assertEquals("1970-01-01T00:00:00Z", DateText.format(0));
		assertEquals("1969-12-31T23:59:59Z", DateText.format(-1));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"2006-02-01T14:29:53Z",
		"2006-02-01T14:29:53.43Z",
		"2006-02-01T15:29:53+01:00",
		"2006-02-01T09:29:53.999-05:00",
	})
	void parsesOffsetsAndFractions(String text) {
		assertEquals(SAMPLE, DateText.parse(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"",
		"yesterday",
		"2006-02-01",
		"2006-02-01T14:29:53",
		"2006-13-01T14:29:53Z",
	})
	void rejectsMalformed(String text) {
		assertThrows(LlsdPrimitiveException.class, () -> DateText.parse(text));
	}

	@Test
	void outOfRangeCannotBeFormatted() {
		assertThrows(LlsdUnsupportedValueException.class, () -> DateText.format(Long.MAX_VALUE));
		assertThrows(LlsdUnsupportedValueException.class, () -> DateText.format(Instant.MAX.getEpochSecond()));
		assertThrows(LlsdUnsupportedValueException.class, () -> DateText.format(DateText.MAX_EPOCH_SECONDS + 1));
		assertThrows(LlsdUnsupportedValueException.class, () -> DateText.format(DateText.MIN_EPOCH_SECONDS - 1));
	}

	@ParameterizedTest
	@MethodSource("extremes")
	void extremesRoundTrip(long epochSeconds) {
		String text = DateText.format(epochSeconds);
		assertEquals(epochSeconds, DateText.parse(text));
	}

	static LongStream extremes() {
		return LongStream.of(DateText.MIN_EPOCH_SECONDS, DateText.MAX_EPOCH_SECONDS);
	}

	@Test
	void extremeText() {
		assertEquals("+999999999-12-31T23:59:59Z", DateText.format(DateText.MAX_EPOCH_SECONDS));
		assertEquals("-999999999-01-01T00:00:00Z", DateText.format(DateText.MIN_EPOCH_SECONDS));
	}

	@Test
	void offsetPushingPastRangeIsRejected() {
		assertThrows(LlsdPrimitiveException.class, () -> DateText.parse("+999999999-12-31T23:59:59-01:00"));
	}
}
