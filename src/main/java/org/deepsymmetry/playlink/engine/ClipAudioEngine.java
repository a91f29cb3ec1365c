package org.deepsymmetry.playlink.engine;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.data.TrackReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.FloatControl;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.File;
import java.io.IOException;

/**
 * An {@link AudioEngine} which plays files through a Java Sound {@link Clip}. It handles whatever formats the
 * installed {@link AudioSystem} providers can decode, which on a plain JDK means WAV, AIFF and AU files.
 */
@API(status = API.Status.STABLE)
public class ClipAudioEngine implements AudioEngine {

    private static final Logger logger = LoggerFactory.getLogger(ClipAudioEngine.class);

    /**
     * The clip holding the current track, or {@code null} when nothing is loaded.
     */
    private Clip clip;

    /**
     * Set while playback is paused, so a clip that is not running is not mistaken for one that has ended.
     */
    private boolean paused;

    /**
     * The volume level to apply to each clip.
     */
    private int volume = 100;

    private boolean closed;

    @Override
    public synchronized void play(TrackReference track) throws EngineException {
        if (closed) {
            throw new EngineException("Audio engine has been closed");
        }
        releaseClip();
        final File file = new File(track.location);
        if (!file.isFile()) {
            throw new EngineException("Track file not found: " + track.location);
        }
        try (AudioInputStream stream = AudioSystem.getAudioInputStream(file)) {
            final Clip newClip = AudioSystem.getClip();
            try {
                newClip.open(stream);
            } catch (LineUnavailableException | IOException | RuntimeException e) {
                newClip.close();
                throw e;
            }
            clip = newClip;
            paused = false;
            applyVolume();
            clip.start();
            logger.info("Playing {}", track.location);
        } catch (UnsupportedAudioFileException e) {
            throw new EngineException("Unsupported audio format: " + track.location, e);
        } catch (IOException e) {
            throw new EngineException("Unable to read track " + track.location, e);
        } catch (LineUnavailableException | IllegalArgumentException e) {
            throw new EngineException("No audio line available to play " + track.location, e);
        }
    }

    @Override
    public synchronized void pause() {
        if (clip != null && !paused) {
            clip.stop();
            paused = true;
        }
    }

    @Override
    public synchronized void resume() {
        if (clip != null && paused) {
            paused = false;
            clip.start();
        }
    }

    @Override
    public synchronized void stop() {
        releaseClip();
    }

    @Override
    public synchronized boolean isBusy() {
        if (clip == null || paused) {
            return false;
        }
        return clip.isRunning() || clip.getFramePosition() < clip.getFrameLength();
    }

    @Override
    public synchronized double getDuration() {
        if (clip == null) {
            return 0.0;
        }
        final long micros = clip.getMicrosecondLength();
        if (micros == AudioSystem.NOT_SPECIFIED || micros < 0) {
            return 0.0;
        }
        return micros / 1_000_000.0;
    }

    @Override
    public synchronized void setVolume(int level) {
        volume = Math.max(0, Math.min(100, level));
        applyVolume();
    }

    /**
     * Get the volume level that is applied to clips.
     *
     * @return the level, from 0 to 100
     */
    @API(status = API.Status.STABLE)
    public synchronized int getVolume() {
        return volume;
    }

    /**
     * Set the master gain of the current clip to match the volume level, if the line offers gain control.
     */
    private void applyVolume() {
        if (clip == null || !clip.isControlSupported(FloatControl.Type.MASTER_GAIN)) {
            return;
        }
        final FloatControl gain = (FloatControl) clip.getControl(FloatControl.Type.MASTER_GAIN);
        final float decibels;
        if (volume == 0) {
            decibels = gain.getMinimum();
        } else {
            decibels = (float) (20.0 * Math.log10(volume / 100.0));
        }
        gain.setValue(Math.max(gain.getMinimum(), Math.min(gain.getMaximum(), decibels)));
    }

    private void releaseClip() {
        if (clip != null) {
            clip.stop();
            clip.close();
            clip = null;
        }
        paused = false;
    }

    @Override
    public synchronized void close() {
        releaseClip();
        closed = true;
    }
}
