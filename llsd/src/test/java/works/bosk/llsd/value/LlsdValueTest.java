package works.bosk.llsd.value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import works.bosk.llsd.exceptions.ErrorKind;
import works.bosk.llsd.exceptions.LlsdTypeMismatchException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlsdValueTest {

	@Test
	void accessorsMatchVariant() {
		UUID id = UUID.fromString("6bad258e-06f0-4a87-a659-493117c9c162");
		assertTrue(LlsdValue.of(true).asBoolean());
		assertEquals(-7, LlsdValue.of(-7).asInteger());
		assertEquals(1.5, LlsdValue.of(1.5).asReal());
		assertEquals(id, LlsdValue.of(id).asUuid());
		assertEquals("hi", LlsdValue.of("hi").asString());
		assertEquals(1_000_000L, LlsdValue.date(1_000_000L).asDate());
		assertEquals("http://example.com/", LlsdValue.uri("http://example.com/").asUri());
		assertArrayEquals(new byte[]{ 1, 2 }, LlsdValue.binary(new byte[]{ 1, 2 }).asBinary());
		assertEquals(List.of(LlsdValue.of(1)), LlsdValue.array(LlsdValue.of(1)).asArray());
		assertEquals(Map.of("a", LlsdValue.of(1)), LlsdValue.map(Map.of("a", LlsdValue.of(1))).asMap());
		assertTrue(LlsdValue.undefined().isUndefined());
	}

	@Test
	void wrongAccessorThrowsTypeMismatch() {
		LlsdValue value = LlsdValue.of("not a number");
		LlsdTypeMismatchException e = assertThrows(LlsdTypeMismatchException.class, value::asInteger);
		assertEquals(LlsdType.INTEGER, e.expected());
		assertEquals(LlsdType.STRING, e.actual());
		assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
		assertThrows(LlsdTypeMismatchException.class, () -> LlsdValue.undefined().asMap());
	}

	@Test
	void asReturnsOptional() {
		LlsdValue value = LlsdValue.of(3);
		assertEquals(Optional.of(new LlsdInteger(3)), value.as(LlsdInteger.class));
		assertEquals(Optional.empty(), value.as(LlsdString.class));
	}

	@Test
	void binaryIsDefensivelyCopiedAndComparedByContent() {
		byte[] bytes = { 1, 2, 3 };
		LlsdBinary binary = LlsdValue.binary(bytes);
		bytes[0] = 99;
		assertEquals(1, binary.asBinary()[0]);
		binary.asBinary()[1] = 99;
		assertEquals(2, binary.asBinary()[1]);
		assertEquals(LlsdValue.binary(new byte[]{ 1, 2, 3 }), binary);
		assertEquals(LlsdValue.binary(new byte[]{ 1, 2, 3 }).hashCode(), binary.hashCode());
		assertNotEquals(LlsdValue.binary(new byte[]{ 1, 2 }), binary);
	}

	@Test
	void mapPreservesInsertionOrder() {
		Map<String, LlsdValue> entries = new LinkedHashMap<>();
		entries.put("zeta", LlsdValue.of(1));
		entries.put("alpha", LlsdValue.of(2));
		entries.put("mid", LlsdValue.of(3));
		assertEquals(List.of("zeta", "alpha", "mid"), List.copyOf(LlsdValue.map(entries).asMap().keySet()));
	}

	@Test
	void builderKeepsLastWriteAtItsPosition() {
		LlsdMap map = LlsdMap.builder()
			.put("a", LlsdValue.of(1))
			.put("b", LlsdValue.of(2))
			.put("a", LlsdValue.of(3))
			.build();
		assertEquals(2, map.size());
		assertEquals(LlsdValue.of(3), map.get("a"));
		assertEquals(List.of("b", "a"), List.copyOf(map.asMap().keySet()));
	}

	@Test
	void containersAreImmutable() {
		LlsdArray array = LlsdValue.array(LlsdValue.of(1));
		assertThrows(UnsupportedOperationException.class, () -> array.asArray().add(LlsdValue.of(2)));
		LlsdMap map = LlsdValue.map(Map.of("a", LlsdValue.of(1)));
		assertThrows(UnsupportedOperationException.class, () -> map.asMap().put("b", LlsdValue.of(2)));
	}

	@Test
	void structuralEquality() {
		LlsdValue a = LlsdValue.array(LlsdValue.of("x"), LlsdValue.map(Map.of("k", LlsdValue.of(1.0))));
		LlsdValue b = LlsdValue.array(List.of(LlsdValue.of("x"), LlsdValue.map(Map.of("k", LlsdValue.of(1.0)))));
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertFalse(a.equals(LlsdValue.array()));
	}

	@Test
	void undefinedAndBooleansAreShared() {
		assertSame(LlsdUndefined.INSTANCE, LlsdValue.undefined());
		assertSame(LlsdBoolean.TRUE, LlsdValue.of(true));
	}

	@Test
	void dateConvertsInstants() {
		Instant instant = Instant.parse("2006-02-01T14:29:53Z");
		LlsdDate date = LlsdValue.date(instant);
		assertEquals(instant.getEpochSecond(), date.epochSeconds());
		assertEquals(instant, date.toInstant());
	}

	@Test
	void nullsRejected() {
		assertThrows(NullPointerException.class, () -> LlsdValue.of((String) null));
		assertThrows(NullPointerException.class, () -> LlsdMap.builder().put("a", null));
	}

	@Test
	void typeReported() {
		assertEquals(LlsdType.REAL, LlsdValue.of(0.0).type());
		assertEquals(LlsdType.MAP, LlsdMap.EMPTY.type());
		assertEquals(LlsdType.ARRAY, LlsdArray.EMPTY.type());
	}
}
