package org.sporkfed.syncengine.model;

import java.util.Optional;

/**
 * A single non-directory entry: regular file, symlink or submodule.
 */
public sealed interface LeafEntry extends RemoteEntry permits FileEntry, SymlinkEntry, SubmoduleEntry {

    String sha();

    String name();

    String path();

    @Override
    default Optional<String> contentIdentity() {
        return Optional.ofNullable(sha());
    }
}
