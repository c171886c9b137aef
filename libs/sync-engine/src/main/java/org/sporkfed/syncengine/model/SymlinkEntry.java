package org.sporkfed.syncengine.model;

public record SymlinkEntry(
        String sha,
        String name,
        String path
) implements LeafEntry {

    @Override
    public EntryType type() {
        return EntryType.SYMLINK;
    }
}
