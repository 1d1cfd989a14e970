/**
 * LLSD XML.
 * <p>
 * Scalars are elements whose text is the value, like {@code <integer>42</integer>};
 * {@code <array>} holds value elements in order, and {@code <map>} holds
 * alternating {@code <key>} and value elements.
 * Parsing uses StAX with DTDs and external entities disabled.
 */
package works.bosk.llsd.codec.xml;
