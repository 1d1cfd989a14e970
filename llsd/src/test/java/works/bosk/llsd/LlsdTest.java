package works.bosk.llsd;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.llsd.codec.LlsdCodec;
import works.bosk.llsd.codec.LlsdFormat;
import works.bosk.llsd.codec.LlsdSettings;
import works.bosk.llsd.codec.notation.NotationVariant;
import works.bosk.llsd.exceptions.LlsdUnknownTypeException;
import works.bosk.llsd.value.LlsdMap;
import works.bosk.llsd.value.LlsdValue;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LlsdTest {
	final LlsdValue sample = LlsdMap.builder()
		.put("a", LlsdValue.array(LlsdValue.of(1), LlsdValue.of("two")))
		.build();

	@Test
	void detectsEachSerializedForm() {
		assertEquals(LlsdFormat.XML, Llsd.detectFormat(LlsdCodec.xml().serialize(sample)));
		assertEquals(LlsdFormat.BINARY, Llsd.detectFormat(LlsdCodec.binary().serialize(sample)));
		assertEquals(LlsdFormat.NOTATION, Llsd.detectFormat(LlsdCodec.notation(NotationVariant.STRING).serialize(sample)));
		assertEquals(LlsdFormat.NOTATION, Llsd.detectFormat(LlsdCodec.notation(NotationVariant.BYTES,
			LlsdSettings.DEFAULT.withNotationHeader(true)).serialize(sample)));
	}

	@Test
	void parsesEachSerializedForm() {
		for (LlsdCodec codec : new LlsdCodec[]{
			LlsdCodec.xml(),
			LlsdCodec.binary(),
			LlsdCodec.binary(LlsdSettings.DEFAULT.withBinaryHeader(false)),
			LlsdCodec.notation(NotationVariant.BYTES),
		}) {
			assertEquals(sample, Llsd.parse(codec.serialize(sample)), codec.format().toString());
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"<?xml version=\"1.0\"?><llsd><undef/></llsd>",
		"\uFEFF<?xml version=\"1.0\"?><llsd><undef/></llsd>",
		"  \n<llsd><undef/></llsd>",
	})
	void xmlVariants(String xml) {
		byte[] bytes = xml.getBytes(UTF_8);
		assertEquals(LlsdFormat.XML, Llsd.detectFormat(bytes));
		assertEquals(LlsdValue.undefined(), Llsd.parse(bytes));
	}

	@ParameterizedTest
	@ValueSource(strings = { "!", "i5", "'x'", "\"x\"", "[i1]", "{}", " true", "u00000000-0000-0000-0000-000000000000" })
	void notationStarts(String notation) {
		assertEquals(LlsdFormat.NOTATION, Llsd.detectFormat(notation.getBytes(UTF_8)));
	}

	@Test
	void headerlessBinaryContainer() {
		byte[] bytes = { '[', 0, 0, 0, 1, 'i', 0, 0, 0, 7, ']' };
		assertEquals(LlsdFormat.BINARY, Llsd.detectFormat(bytes));
		assertEquals(LlsdValue.array(LlsdValue.of(7)), Llsd.parse(bytes));
	}

	@ParameterizedTest
	@ValueSource(strings = { "", "   ", "hello", "<html></html>" })
	void unrecognized(String input) {
		assertThrows(LlsdUnknownTypeException.class, () -> Llsd.parse(input.getBytes(UTF_8)));
	}
}
