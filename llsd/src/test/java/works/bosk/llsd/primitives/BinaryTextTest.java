package works.bosk.llsd.primitives;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import works.bosk.llsd.exceptions.LlsdPrimitiveException;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BinaryTextTest {
	static final byte[] HELLO = "hello".getBytes(US_ASCII);

	@Test
	void encodes() {
		assertEquals("aGVsbG8=", BinaryText.encode(HELLO, BinaryEncoding.BASE64));
		assertEquals("68656c6c6f", BinaryText.encode(HELLO, BinaryEncoding.BASE16));
	}

	@Test
	void decodingIgnoresWhitespaceAndHexCase() {
		assertArrayEquals(HELLO, BinaryText.decode(" aGVs\n bG8=\t", BinaryEncoding.BASE64));
		assertArrayEquals(HELLO, BinaryText.decode("68656C6C6F", BinaryEncoding.BASE16));
	}

	@ParameterizedTest
	@EnumSource(BinaryEncoding.class)
	void emptyIsEmpty(BinaryEncoding encoding) {
		assertEquals("", BinaryText.encode(new byte[0], encoding));
		assertArrayEquals(new byte[0], BinaryText.decode("", encoding));
	}

	@Test
	void rejectsInvalid() {
		assertThrows(LlsdPrimitiveException.class, () -> BinaryText.decode("a*b", BinaryEncoding.BASE64));
		assertThrows(LlsdPrimitiveException.class, () -> BinaryText.decode("abc", BinaryEncoding.BASE16));
		assertThrows(LlsdPrimitiveException.class, () -> BinaryText.decode("zz", BinaryEncoding.BASE16));
	}

	@Test
	void encodingNames() {
		assertEquals(BinaryEncoding.BASE64, BinaryText.encodingNamed("base64"));
		assertEquals(BinaryEncoding.BASE16, BinaryText.encodingNamed("base16"));
		assertEquals(BinaryEncoding.BASE16, BinaryText.encodingNamed("hex"));
		assertThrows(LlsdPrimitiveException.class, () -> BinaryText.encodingNamed("base85"));
	}
}
