package org.sporkfed.syncengine.model;

import java.util.List;
import java.util.Optional;

/**
 * A directory listing. Entries are the leaf entries of the listing plus one unexpanded
 * {@code DirectoryEntry} per sub-directory; sub-directories are never listed themselves.
 */
public record DirectoryEntry(
        String path,
        List<RemoteEntry> entries
) implements RemoteEntry {

    public DirectoryEntry {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * A sub-directory seen inside a listing, without its contents.
     */
    public static DirectoryEntry unexpanded(String path) {
        return new DirectoryEntry(path, List.of());
    }

    @Override
    public EntryType type() {
        return EntryType.DIRECTORY;
    }

    @Override
    public Optional<String> contentIdentity() {
        return Optional.empty();
    }

    /**
     * First entry whose path equals {@code entryPath}.
     */
    public Optional<RemoteEntry> findByPath(String entryPath) {
        return entries.stream()
                .filter(entry -> entryPath != null && entryPath.equals(pathOf(entry)))
                .findFirst();
    }

    private static String pathOf(RemoteEntry entry) {
        if (entry instanceof LeafEntry leaf) {
            return leaf.path();
        }
        if (entry instanceof DirectoryEntry directory) {
            return directory.path();
        }
        return null;
    }
}
