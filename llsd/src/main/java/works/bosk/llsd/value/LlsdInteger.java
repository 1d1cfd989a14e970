package works.bosk.llsd.value;

public record LlsdInteger(int value) implements LlsdValue {
	@Override
	public LlsdType type() {
		return LlsdType.INTEGER;
	}

	@Override
	public int asInteger() {
		return value;
	}

	@Override
	public String toString() {
		return "i" + value;
	}
}
