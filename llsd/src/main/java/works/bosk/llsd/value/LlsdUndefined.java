package works.bosk.llsd.value;

/**
 * The absence of a value. There is exactly one instance.
 */
public record LlsdUndefined() implements LlsdValue {
	public static final LlsdUndefined INSTANCE = new LlsdUndefined();

	@Override
	public LlsdType type() {
		return LlsdType.UNDEFINED;
	}

	@Override
	public String toString() {
		return "undef";
	}
}
