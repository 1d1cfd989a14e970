package works.bosk.llsd.value;

import java.util.UUID;

import static java.util.Objects.requireNonNull;

public record LlsdUuid(UUID value) implements LlsdValue {
	public LlsdUuid {
		requireNonNull(value);
	}

	@Override
	public LlsdType type() {
		return LlsdType.UUID;
	}

	@Override
	public UUID asUuid() {
		return value;
	}

	@Override
	public String toString() {
		return "u" + value;
	}
}
