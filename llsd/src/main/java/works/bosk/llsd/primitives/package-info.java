/**
 * Low-level conversions shared by all the codecs:
 * UUID, date, real-number and binary text forms, and strict UTF-8.
 * Keeping them here means the three formats cannot disagree on what a given text means.
 */
package works.bosk.llsd.primitives;
