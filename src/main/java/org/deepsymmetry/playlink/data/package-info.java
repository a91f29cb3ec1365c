/**
 * <p>Playlists, the navigator that moves through them, and the immutable snapshots that describe what is playing.</p>
 */
package org.deepsymmetry.playlink.data;
