package org.deepsymmetry.playlink.data;

import org.apiguardian.api.API;

/**
 * An immutable snapshot of where a {@link TrackNavigator} stands within its playlist. The indices are only
 * meaningful against the playlist length at the moment the snapshot was taken.
 */
@API(status = API.Status.STABLE)
public class NavigationCursor {

    /**
     * The index of the current track.
     */
    @API(status = API.Status.STABLE)
    public final int currentIndex;

    /**
     * The index that a sequential {@link Direction#NEXT} would move to.
     */
    @API(status = API.Status.STABLE)
    public final int nextIndex;

    /**
     * The index that {@link Direction#PREVIOUS} would move to.
     */
    @API(status = API.Status.STABLE)
    public final int prevIndex;

    /**
     * Whether the navigator was in shuffle mode.
     */
    @API(status = API.Status.STABLE)
    public final boolean shuffle;

    /**
     * Constructor used by the navigator when taking a snapshot.
     *
     * @param currentIndex the index of the current track
     * @param nextIndex the index sequential navigation would move forward to
     * @param prevIndex the index backward navigation would move to
     * @param shuffle whether shuffle mode is active
     */
    @API(status = API.Status.STABLE)
    public NavigationCursor(int currentIndex, int nextIndex, int prevIndex, boolean shuffle) {
        this.currentIndex = currentIndex;
        this.nextIndex = nextIndex;
        this.prevIndex = prevIndex;
        this.shuffle = shuffle;
    }

    @Override
    public String toString() {
        return "NavigationCursor[currentIndex:" + currentIndex + ", nextIndex:" + nextIndex +
                ", prevIndex:" + prevIndex + ", shuffle:" + shuffle + "]";
    }
}
