package org.sporkfed.syncengine.service;

import org.sporkfed.syncengine.model.FileEntry;
import org.sporkfed.syncengine.model.RemoteEntry;
import org.sporkfed.syncengine.model.SyncDecision;
import org.springframework.stereotype.Component;

/**
 * Compares the source file with the resolved target. Content is always replaced wholesale.
 */
@Component
public class SyncDecider {

    public SyncDecision decide(FileEntry source, RemoteEntry target) {
        return switch (target.type()) {
            case SYMLINK, SUBMODULE, DIRECTORY -> SyncDecision.rejected(
                    "Target file must be of 'file' type, found '" + target.type().getTypeString() + "'");
            case ABSENT -> SyncDecision.create("Target file does not exist");
            case FILE -> target.contentIdentity()
                    .filter(sha -> sha.equals(source.sha()))
                    .map(sha -> SyncDecision.noop("Target is already up to date"))
                    .orElseGet(() -> SyncDecision.update("Target content differs from source"));
        };
    }
}
