package works.bosk.llsd.exceptions;

import org.junit.jupiter.api.Test;
import works.bosk.llsd.value.LlsdType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class LlsdExceptionTest {

	@Test
	void offsetAppearsInMessage() {
		LlsdException e = new LlsdSyntaxException("Unterminated array", 17);
		assertEquals("Unterminated array at offset 17", e.getMessage());
		assertEquals("Unterminated array", e.detail());
		assertEquals(17, e.offset());
		assertEquals(ErrorKind.MALFORMED_STRUCTURE, e.kind());
	}

	@Test
	void unknownOffsetIsOmitted() {
		LlsdException e = new LlsdUnsupportedValueException("Too big");
		assertEquals("Too big", e.getMessage());
		assertEquals(LlsdException.UNKNOWN_OFFSET, e.offset());
		assertEquals(ErrorKind.UNSUPPORTED_VALUE, e.kind());
	}

	@Test
	void primitiveAtAddsPositionOnce() {
		LlsdPrimitiveException bare = new LlsdPrimitiveException("Invalid integer \"x\"");
		LlsdPrimitiveException located = bare.at(5);
		assertEquals(5, located.offset());
		assertSame(bare, located.getCause());
		assertSame(located, located.at(9));
	}

	@Test
	void kinds() {
		assertEquals(ErrorKind.UNKNOWN_TYPE, new LlsdUnknownTypeException("?").kind());
		assertEquals(ErrorKind.INVALID_PRIMITIVE, new LlsdPrimitiveException("?").kind());
		LlsdTypeMismatchException mismatch = new LlsdTypeMismatchException(LlsdType.MAP, LlsdType.ARRAY);
		assertEquals(ErrorKind.TYPE_MISMATCH, mismatch.kind());
		assertEquals(LlsdType.MAP, mismatch.expected());
		assertEquals(LlsdType.ARRAY, mismatch.actual());
	}
}
