package org.deepsymmetry.playlink.engine;

import org.deepsymmetry.playlink.data.TrackReference;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ClipAudioEngineTest {

    private ClipAudioEngine engine;

    @Before
    public void setUp() {
        engine = new ClipAudioEngine();
    }

    @After
    public void tearDown() {
        engine.close();
    }

    @Test
    public void idleEngineHasNothingLoaded() {
        assertFalse(engine.isBusy());
        assertEquals(0.0, engine.getDuration(), 0.0);
        engine.pause();
        engine.resume();
        engine.stop();
        assertFalse(engine.isBusy());
    }

    @Test(expected = EngineException.class)
    public void missingFileIsRejected() throws Exception {
        engine.play(new TrackReference("/no/such/directory/missing.wav"));
    }

    @Test
    public void undecodableFileIsRejected() throws Exception {
        final File garbage = File.createTempFile("garbage", ".wav");
        garbage.deleteOnExit();
        Files.write(garbage.toPath(), "this is not audio".getBytes(StandardCharsets.UTF_8));
        try {
            engine.play(new TrackReference(garbage.getAbsolutePath()));
            fail("Expected an undecodable file to be rejected");
        } catch (EngineException e) {
            assertFalse(engine.isBusy());
        }
    }

    @Test
    public void volumeIsClamped() {
        engine.setVolume(-5);
        assertEquals(0, engine.getVolume());
        engine.setVolume(500);
        assertEquals(100, engine.getVolume());
        engine.setVolume(42);
        assertEquals(42, engine.getVolume());
    }

    @Test
    public void closedEngineRefusesToPlay() throws Exception {
        final File garbage = File.createTempFile("closed", ".wav");
        garbage.deleteOnExit();
        engine.close();
        try {
            engine.play(new TrackReference(garbage.getAbsolutePath()));
            fail("Expected a closed engine to refuse to play");
        } catch (EngineException e) {
            assertTrue(e.getMessage().contains("closed"));
        }
    }
}
