package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.engine.AudioEngine;
import org.deepsymmetry.playlink.source.AbstractSource;
import org.deepsymmetry.playlink.source.Capability;
import org.deepsymmetry.playlink.source.SourcePlayback;
import org.deepsymmetry.playlink.source.SourceRegistry;

import java.util.List;

/**
 * The source which plays the local playlist through the local {@link AudioEngine}. It is always loaded, and it is
 * the source that takes over whenever a plugin source gives up control.
 *
 * <p>Its playback report is computed live from the player and engine every time it is asked, never cached.</p>
 */
@API(status = API.Status.STABLE)
public class LocalSource extends AbstractSource {

    /**
     * The name under which the local source is registered.
     */
    @API(status = API.Status.STABLE)
    public static final String NAME = SourceRegistry.LOCAL_SOURCE;

    private final PlayerStateMachine player;

    private final AudioEngine engine;

    /**
     * Create the local source.
     *
     * @param player the state machine driving the local engine
     * @param engine the engine that produces the sound
     */
    @API(status = API.Status.STABLE)
    public LocalSource(PlayerStateMachine player, AudioEngine engine) {
        super(NAME, null, Capability.values());
        this.player = player;
        this.engine = engine;
    }

    @Override
    public boolean play(List<String> args) {
        return player.localPlay();
    }

    @Override
    public boolean pause(List<String> args) {
        return player.localPause();
    }

    @Override
    public boolean stop(List<String> args) {
        return player.localStop();
    }

    @Override
    public boolean next(List<String> args) {
        return player.localNext();
    }

    @Override
    public boolean prev(List<String> args) {
        return player.localPrevious();
    }

    @Override
    public boolean setVolume(int level) {
        engine.setVolume(level);
        return true;
    }

    @Override
    public SourcePlayback getCurrentPlayback() {
        final PlayerState state = player.getState();
        if (state == PlayerState.STOPPED) {
            return null;
        }
        final String trackName = (player.getCurrentTrack() == null) ? null : player.getCurrentTrack().name;
        return new SourcePlayback(trackName, null, null, player.getElapsedSeconds(), player.getTrackLength(),
                state == PlayerState.PLAYING || engine.isBusy());
    }
}
