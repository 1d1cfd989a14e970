/**
 * Binary LLSD.
 * <p>
 * Each value starts with a one-byte tag. Integers are 4 bytes, reals and dates 8,
 * UUIDs 16; strings, URIs, map keys and binary payloads carry a 4-byte length,
 * and arrays and maps a 4-byte count followed by their members and a closing tag.
 */
package works.bosk.llsd.codec.binary;
