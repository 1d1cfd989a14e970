package works.bosk.llsd.value;

/**
 * The variants of {@link LlsdValue}.
 * Codecs dispatch on this with exhaustive {@code switch} expressions,
 * so a new constant here fails compilation until every codec handles it.
 */
public enum LlsdType {
	UNDEFINED,
	BOOLEAN,
	INTEGER,
	REAL,
	UUID,
	STRING,
	DATE,
	URI,
	BINARY,
	ARRAY,
	MAP,
}
