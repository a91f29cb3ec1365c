/**
 * <p>A library for playing media from several interchangeable sources through one set of transport controls, while
 * making sure only one source is ever producing sound.</p>
 *
 * <p>Applications create a {@link org.deepsymmetry.playlink.PlaybackContext}, which builds and wires everything
 * else. Transport commands go to its {@link org.deepsymmetry.playlink.PlayerStateMachine}, which drives the local
 * engine when the local source is active and passes commands on to the active plugin source otherwise. The
 * {@link org.deepsymmetry.playlink.PlaybackOrchestrator} decides which source is active, silencing the outgoing
 * source before any switch, and the {@link org.deepsymmetry.playlink.Watchdog} notices when local tracks end so the
 * player can move on to the next one.</p>
 *
 * <p>Everything that changes about playback is recorded by the {@link org.deepsymmetry.playlink.PlaybackTracker} and
 * announced through the {@link org.deepsymmetry.playlink.EventBus}, where listeners subscribe to the
 * {@link org.deepsymmetry.playlink.EventType}s they care about.</p>
 *
 * <p>Sources live in the {@link org.deepsymmetry.playlink.source} package, playlists and navigation in
 * {@link org.deepsymmetry.playlink.data}, and the local audio engine in {@link org.deepsymmetry.playlink.engine}.</p>
 */
package org.deepsymmetry.playlink;
