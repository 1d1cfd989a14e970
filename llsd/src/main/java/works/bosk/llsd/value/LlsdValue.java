package works.bosk.llsd.value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import works.bosk.llsd.exceptions.LlsdTypeMismatchException;

/**
 * An immutable node in an LLSD value tree.
 * <p>
 * Every variant is a record implementing this interface.
 * The {@code asXxx} accessors return the payload if this value is of the corresponding variant,
 * and throw {@link LlsdTypeMismatchException} otherwise.
 * For a non-throwing alternative, use {@link #as(Class)}.
 */
public sealed interface LlsdValue permits
	LlsdUndefined,
	LlsdBoolean,
	LlsdInteger,
	LlsdReal,
	LlsdUuid,
	LlsdString,
	LlsdDate,
	LlsdUri,
	LlsdBinary,
	LlsdArray,
	LlsdMap
{
	LlsdType type();

	static LlsdUndefined undefined() {
		return LlsdUndefined.INSTANCE;
	}

	static LlsdBoolean of(boolean value) {
		return value ? LlsdBoolean.TRUE : LlsdBoolean.FALSE;
	}

	static LlsdInteger of(int value) {
		return new LlsdInteger(value);
	}

	static LlsdReal of(double value) {
		return new LlsdReal(value);
	}

	static LlsdUuid of(UUID value) {
		return new LlsdUuid(value);
	}

	static LlsdString of(String value) {
		return new LlsdString(value);
	}

	static LlsdDate date(long epochSeconds) {
		return new LlsdDate(epochSeconds);
	}

	static LlsdDate date(Instant instant) {
		return LlsdDate.of(instant);
	}

	static LlsdUri uri(String value) {
		return new LlsdUri(value);
	}

	static LlsdBinary binary(byte[] bytes) {
		return new LlsdBinary(bytes);
	}

	static LlsdArray array(LlsdValue... elements) {
		return new LlsdArray(List.of(elements));
	}

	static LlsdArray array(List<? extends LlsdValue> elements) {
		return new LlsdArray(List.copyOf(elements));
	}

	static LlsdMap map(Map<String, ? extends LlsdValue> entries) {
		return LlsdMap.builder().putAll(entries).build();
	}

	/**
	 * @return this value cast to {@code variant}, or empty if it is some other variant
	 */
	default <T extends LlsdValue> Optional<T> as(Class<T> variant) {
		if (variant.isInstance(this)) {
			return Optional.of(variant.cast(this));
		} else {
			return Optional.empty();
		}
	}

	default boolean isUndefined() {
		return type() == LlsdType.UNDEFINED;
	}

	default boolean asBoolean() {
		throw mismatch(LlsdType.BOOLEAN);
	}

	default int asInteger() {
		throw mismatch(LlsdType.INTEGER);
	}

	default double asReal() {
		throw mismatch(LlsdType.REAL);
	}

	default UUID asUuid() {
		throw mismatch(LlsdType.UUID);
	}

	default String asString() {
		throw mismatch(LlsdType.STRING);
	}

	/**
	 * @return seconds since the Unix epoch, UTC
	 */
	default long asDate() {
		throw mismatch(LlsdType.DATE);
	}

	default String asUri() {
		throw mismatch(LlsdType.URI);
	}

	/**
	 * @return a fresh copy of the bytes
	 */
	default byte[] asBinary() {
		throw mismatch(LlsdType.BINARY);
	}

	default List<LlsdValue> asArray() {
		throw mismatch(LlsdType.ARRAY);
	}

	default Map<String, LlsdValue> asMap() {
		throw mismatch(LlsdType.MAP);
	}

	private LlsdTypeMismatchException mismatch(LlsdType expected) {
		return new LlsdTypeMismatchException(expected, type());
	}
}
