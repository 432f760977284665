/**
 * Configuration records, YAML loading, precedence merging and the composition root.
 * <p>Effective settings follow CLI &gt; YAML &gt; defaults; see {@link ca.gc.cra.tbfs.config.ConfigMerger}.</p>
 */
package ca.gc.cra.tbfs.config;
