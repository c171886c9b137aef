package org.sporkfed.syncengine.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.sporkfed.syncengine.model.AbsentEntry;
import org.sporkfed.syncengine.model.DirectoryEntry;
import org.sporkfed.syncengine.model.FileEntry;
import org.sporkfed.syncengine.model.LeafEntry;
import org.sporkfed.syncengine.model.RemoteEntry;
import org.sporkfed.syncengine.model.SubmoduleEntry;
import org.sporkfed.syncengine.model.SymlinkEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a raw contents API payload onto a {@link RemoteEntry}.
 * <p>
 * An object is classified by its {@code type}; an array is a directory listing whose
 * sub-directories are kept as unexpanded entries. Unknown types become {@link AbsentEntry}, so new
 * remote types degrade to "not usable" instead of failing.
 */
@Component
public class EntryClassifier {

    private static final String DIR_TYPE = "dir";

    public RemoteEntry classify(JsonNode raw, String path) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return AbsentEntry.INSTANCE;
        }

        if (raw.isArray()) {
            List<RemoteEntry> entries = new ArrayList<>();
            for (JsonNode element : raw) {
                String elementPath = element.path("path").asText(null);
                if (DIR_TYPE.equals(element.path("type").asText())) {
                    entries.add(DirectoryEntry.unexpanded(elementPath));
                    continue;
                }
                RemoteEntry entry = classify(element, elementPath);
                if (entry instanceof LeafEntry leaf) {
                    entries.add(leaf);
                }
            }
            return new DirectoryEntry(path, entries);
        }

        String entryPath = textOrDefault(raw, "path", path);
        String name = textOrDefault(raw, "name", fileName(entryPath));
        String sha = textOrDefault(raw, "sha", null);

        return switch (raw.path("type").asText("")) {
            case "file" -> new FileEntry(
                    sha,
                    textOrDefault(raw, "content", null),
                    textOrDefault(raw, "encoding", null),
                    name,
                    entryPath
            );
            case "symlink" -> new SymlinkEntry(sha, name, entryPath);
            case "submodule" -> new SubmoduleEntry(sha, name, entryPath);
            default -> AbsentEntry.INSTANCE;
        };
    }

    private static String textOrDefault(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : fallback;
    }

    private static String fileName(String path) {
        if (path == null) {
            return null;
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
