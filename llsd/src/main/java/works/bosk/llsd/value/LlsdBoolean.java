package works.bosk.llsd.value;

public record LlsdBoolean(boolean value) implements LlsdValue {
	public static final LlsdBoolean TRUE = new LlsdBoolean(true);
	public static final LlsdBoolean FALSE = new LlsdBoolean(false);

	@Override
	public LlsdType type() {
		return LlsdType.BOOLEAN;
	}

	@Override
	public boolean asBoolean() {
		return value;
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
