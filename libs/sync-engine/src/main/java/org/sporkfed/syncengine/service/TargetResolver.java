package org.sporkfed.syncengine.service;

import org.sporkfed.syncengine.model.AbsentEntry;
import org.sporkfed.syncengine.model.DirectoryEntry;
import org.sporkfed.syncengine.model.FileEntry;
import org.sporkfed.syncengine.model.RemoteEntry;
import org.sporkfed.syncengine.model.TargetResolution;
import org.springframework.stereotype.Component;

/**
 * Decides which file a rule writes to. When the configured target is a directory the source
 * file keeps its own name inside it; otherwise the configured path is the file.
 */
@Component
public class TargetResolver {

    public TargetResolution resolve(FileEntry source, RemoteEntry targetRoot, String configuredTargetPath) {
        if (targetRoot instanceof DirectoryEntry directory) {
            String effectivePath = childPath(configuredTargetPath, source.name());
            RemoteEntry effectiveEntry = directory.findByPath(effectivePath).orElse(AbsentEntry.INSTANCE);
            return new TargetResolution(effectivePath, effectiveEntry);
        }
        return new TargetResolution(configuredTargetPath, targetRoot);
    }

    static String childPath(String directoryPath, String name) {
        String base = directoryPath == null ? "" : directoryPath;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base.isEmpty() ? name : base + "/" + name;
    }
}
