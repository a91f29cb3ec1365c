/**
 * <p>The contract that media sources implement, and the registry which discovers, loads and unloads them.</p>
 *
 * <p>Sources are found through {@link java.util.ServiceLoader} by listing {@link
 * org.deepsymmetry.playlink.source.SourceProvider} implementations in
 * {@code META-INF/services/org.deepsymmetry.playlink.source.SourceProvider}. Extending
 * {@link org.deepsymmetry.playlink.source.AbstractSource} is the easiest way to write one.</p>
 */
package org.deepsymmetry.playlink.source;
