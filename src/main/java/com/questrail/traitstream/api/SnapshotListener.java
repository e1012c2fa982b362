package com.questrail.traitstream.api;

/**
 * Receives snapshots from a background stream runner.
 *
 * <p>Called on the runner's worker thread, one snapshot at a time. A slow
 * listener delays the next transport read.</p>
 */
@FunctionalInterface
public interface SnapshotListener
{
    void onSnapshot(StateSnapshot snapshot);
}
