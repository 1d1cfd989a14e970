/**
 * The exceptions thrown by LLSD parsing, generation, and typed access.
 * All are unchecked and descend from {@link works.bosk.llsd.exceptions.LlsdException},
 * whose {@link works.bosk.llsd.exceptions.LlsdException#kind() kind} identifies the category of failure.
 */
package works.bosk.llsd.exceptions;
