package works.bosk.llsd.value;

/**
 * A 64-bit floating point value.
 * <p>
 * Infinities and NaN are allowed here even though not every codec can carry them.
 * Equality is that of {@link Double#compare}: all NaNs are equal to each other,
 * and {@code 0.0} is not equal to {@code -0.0}.
 */
public record LlsdReal(double value) implements LlsdValue {
	@Override
	public LlsdType type() {
		return LlsdType.REAL;
	}

	@Override
	public double asReal() {
		return value;
	}

	public boolean isFinite() {
		return Double.isFinite(value);
	}

	@Override
	public String toString() {
		return "r" + value;
	}
}
