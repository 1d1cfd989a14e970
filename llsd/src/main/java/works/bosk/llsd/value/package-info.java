/**
 * The LLSD value tree: a closed set of immutable variants under
 * {@link works.bosk.llsd.value.LlsdValue}, each identified by an {@link works.bosk.llsd.value.LlsdType}.
 * <p>
 * Values have no back-references and no mutation operations,
 * so a tree can be shared freely between threads once constructed.
 */
package works.bosk.llsd.value;
