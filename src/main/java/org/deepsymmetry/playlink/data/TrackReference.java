package org.deepsymmetry.playlink.data;

import org.apiguardian.api.API;

import java.util.Objects;

/**
 * Identifies a track that can be played by the local engine. Two references are equal when they point at the same
 * location, so the same file can be found in a playlist regardless of how the reference was created.
 */
@API(status = API.Status.STABLE)
public class TrackReference {

    /**
     * Where the track can be found, usually a file system path.
     */
    @API(status = API.Status.STABLE)
    public final String location;

    /**
     * The name used when reporting the track, which is the last element of its location.
     */
    @API(status = API.Status.STABLE)
    public final String name;

    /**
     * We are immutable so we can precompute our hash code.
     */
    private final int hashcode;

    /**
     * Create a reference to the track at the specified location.
     *
     * @param location where the track can be found
     *
     * @throws IllegalArgumentException if {@code location} is {@code null} or empty
     */
    @API(status = API.Status.STABLE)
    public TrackReference(String location) {
        if (location == null || location.isEmpty()) {
            throw new IllegalArgumentException("location must not be empty");
        }
        this.location = location;
        name = nameFromLocation(location);
        hashcode = Objects.hash(location);
    }

    /**
     * Find the part of a location after the last path separator.
     *
     * @param location the location to be examined
     *
     * @return the file name portion
     */
    private static String nameFromLocation(String location) {
        final int slash = Math.max(location.lastIndexOf('/'), location.lastIndexOf('\\'));
        if (slash >= 0 && slash < location.length() - 1) {
            return location.substring(slash + 1);
        }
        return location;
    }

    @Override
    public int hashCode() {
        return hashcode;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TrackReference && ((TrackReference) obj).location.equals(location);
    }

    @Override
    public String toString() {
        return "TrackReference[location:" + location + "]";
    }
}
