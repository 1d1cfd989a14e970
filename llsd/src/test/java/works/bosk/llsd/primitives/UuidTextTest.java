package works.bosk.llsd.primitives;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UuidTextTest {

	@Test
	void nilFormatsAsZeros() {
		assertEquals("00000000-0000-0000-0000-000000000000", UuidText.format(UuidText.NIL));
	}

	@Test
	void parsesEitherCase() {
		UUID expected = UUID.fromString("6bad258e-06f0-4a87-a659-493117c9c162");
		assertEquals(expected, UuidText.parse("6bad258e-06f0-4a87-a659-493117c9c162"));
		assertEquals(expected, UuidText.parse("6BAD258E-06F0-4A87-A659-493117C9C162"));
		assertEquals("6bad258e-06f0-4a87-a659-493117c9c162", UuidText.format(expected));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"",
		"6bad258e06f04a87a659493117c9c162",
		"6bad258e-06f0-4a87-a659-493117c9c16",
		"6bad258e-06f0-4a87-a659-493117c9c1623",
		"6bad258e-06f04-a87-a659-493117c9c162",
		"6bad258e-06f0-4a87-a659-493117c9c16g",
	})
	void rejectsMalformed(String text) {
		assertThrows(LlsdPrimitiveException.class, () -> UuidText.parse(text));
	}

	@Test
	void bytesAreMostSignificantFirst() {
		UUID uuid = UUID.fromString("00010203-0405-0607-0809-0a0b0c0d0e0f");
		byte[] bytes = UuidText.toBytes(uuid);
		for (int i = 0; i < UuidText.BYTE_LENGTH; i++) {
			assertEquals(i, bytes[i]);
		}
		byte[] padded = new byte[20];
		System.arraycopy(bytes, 0, padded, 3, bytes.length);
		assertEquals(uuid, UuidText.fromBytes(padded, 3));
		assertArrayEquals(new byte[16], UuidText.toBytes(UuidText.NIL));
	}
}
