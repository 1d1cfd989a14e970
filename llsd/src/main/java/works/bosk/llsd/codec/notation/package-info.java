/**
 * LLSD notation, in its byte and string variants.
 */
package works.bosk.llsd.codec.notation;
