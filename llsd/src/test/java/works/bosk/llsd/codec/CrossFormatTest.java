package works.bosk.llsd.codec;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import works.bosk.llsd.codec.notation.NotationVariant;
import works.bosk.llsd.exceptions.LlsdUnsupportedValueException;
import works.bosk.llsd.value.LlsdMap;
import works.bosk.llsd.value.LlsdValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CrossFormatTest {
	final LlsdCodec xml = LlsdCodec.xml();
	final LlsdCodec binary = LlsdCodec.binary();
	final LlsdCodec notation = LlsdCodec.notation(NotationVariant.STRING);

	final LlsdValue sample = LlsdMap.builder()
		.put("id", LlsdValue.of(UUID.fromString("6bad258e-06f0-4a87-a659-493117c9c162")))
		.put("stats", LlsdValue.array(LlsdValue.of(0.25), LlsdValue.of(-3), LlsdValue.of(true)))
		.put("blob", LlsdValue.binary(new byte[]{ 9, 8, 7 }))
		.put("when", LlsdValue.date(1138804193L))
		.put("link", LlsdValue.uri("http://example.com"))
		.put("nothing", LlsdValue.undefined())
		.build();

	@Test
	void xmlToBinaryToNotationAndBack() {
		LlsdValue viaXml = xml.parse(xml.serialize(sample));
		LlsdValue viaBinary = binary.parse(binary.serialize(viaXml));
		LlsdValue viaNotation = notation.parse(notation.serialize(viaBinary));
		LlsdValue back = xml.parse(xml.serialize(viaNotation));
		assertEquals(sample, back);
	}

	@Test
	void infinityFailsOnlyInNotation() {
		LlsdValue value = LlsdValue.array(LlsdValue.of(Double.POSITIVE_INFINITY));
		assertEquals(value, binary.parse(binary.serialize(value)));
		assertEquals(value, xml.parse(xml.serialize(value)));
		assertThrows(LlsdUnsupportedValueException.class, () -> notation.serialize(value));
	}

	@Test
	void formatsReportThemselves() {
		assertEquals(LlsdFormat.XML, xml.format());
		assertEquals(LlsdFormat.BINARY, binary.format());
		assertEquals(LlsdFormat.NOTATION, notation.format());
		for (LlsdFormat format : LlsdFormat.values()) {
			assertEquals(format, format.codec(LlsdSettings.DEFAULT).format());
		}
	}
}
