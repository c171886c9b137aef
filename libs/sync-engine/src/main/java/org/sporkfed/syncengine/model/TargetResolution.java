package org.sporkfed.syncengine.model;

/**
 * The file a rule actually writes to, after resolving a directory target.
 */
public record TargetResolution(
        String effectivePath,
        RemoteEntry effectiveEntry
) {
}
