package org.deepsymmetry.playlink;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared by the fake engine and fake sources to catch any moment at which more than one of them is producing
 * sound, and to record the order in which they started and stopped.
 */
public class ExclusivityMonitor {

    private final Set<String> playing = new LinkedHashSet<>();
    private final List<String> violations = new ArrayList<>();
    private final List<String> history = new ArrayList<>();

    public synchronized void started(String who) {
        playing.add(who);
        history.add("start:" + who);
        if (playing.size() > 1) {
            violations.add("Simultaneously playing: " + playing);
        }
    }

    public synchronized void stopped(String who) {
        if (playing.remove(who)) {
            history.add("stop:" + who);
        }
    }

    public synchronized boolean isPlaying(String who) {
        return playing.contains(who);
    }

    public synchronized List<String> getViolations() {
        return new ArrayList<>(violations);
    }

    public synchronized List<String> getHistory() {
        return new ArrayList<>(history);
    }
}
