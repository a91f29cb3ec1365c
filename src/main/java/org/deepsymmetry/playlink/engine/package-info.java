/**
 * The local audio engine abstraction and its Java Sound implementation.
 */
package org.deepsymmetry.playlink.engine;
