package works.bosk.llsd.value;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * An ordered sequence of bytes.
 * The array is copied on construction and by {@link #bytes()}, so instances stay immutable.
 */
public record LlsdBinary(byte[] bytes) implements LlsdValue {
	public LlsdBinary {
		bytes = bytes.clone();
	}

	@Override
	public byte[] bytes() {
		return bytes.clone();
	}

	public int length() {
		return bytes.length;
	}

	@Override
	public LlsdType type() {
		return LlsdType.BINARY;
	}

	@Override
	public byte[] asBinary() {
		return bytes.clone();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof LlsdBinary other && Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "b16\"" + HexFormat.of().formatHex(bytes) + '"';
	}
}
