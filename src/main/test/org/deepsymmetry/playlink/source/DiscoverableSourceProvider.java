package org.deepsymmetry.playlink.source;

import org.deepsymmetry.playlink.ExclusivityMonitor;
import org.deepsymmetry.playlink.FakeSource;
import org.deepsymmetry.playlink.PlaybackCallback;

/**
 * Found through the service registration in the test resources, so discovery can be checked.
 */
public class DiscoverableSourceProvider implements SourceProvider {

    public static final String NAME = "test-source";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Source createSource(PlaybackCallback callback) {
        return new FakeSource(NAME, callback, new ExclusivityMonitor());
    }
}
