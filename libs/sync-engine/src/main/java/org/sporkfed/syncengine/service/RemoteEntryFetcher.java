package org.sporkfed.syncengine.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.sporkfed.syncengine.logging.SyncEventLogger;
import org.sporkfed.syncengine.logging.SyncLogTag;
import org.sporkfed.syncengine.model.AbsentEntry;
import org.sporkfed.syncengine.model.EntryType;
import org.sporkfed.syncengine.model.FetchSide;
import org.sporkfed.syncengine.model.RemoteEntry;
import org.sporkfed.syncengine.model.RepoCoordinates;
import org.sporkfed.syncengine.model.SyncContext;
import org.sporkfed.vcsclient.github.GitHubException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;

import static org.sporkfed.syncengine.logging.SyncEventLogger.fields;

/**
 * Fetches one repository path and classifies it. Every failure, a missing path included,
 * yields {@link AbsentEntry}.
 */
@Service
public class RemoteEntryFetcher {

    private final EntryClassifier entryClassifier;
    private final SyncEventLogger eventLogger;

    public RemoteEntryFetcher(EntryClassifier entryClassifier, SyncEventLogger eventLogger) {
        this.entryClassifier = entryClassifier;
        this.eventLogger = eventLogger;
    }

    /**
     * @param ref branch to read from, {@code null} for the repository default branch
     */
    public RemoteEntry fetch(SyncContext context, FetchSide side, RepoCoordinates repository, String path, String ref) {
        Map<String, Object> fetchFields = fields(
                "target", side.getLabel(),
                "repository", repository.getFullName(),
                "path", path,
                "ref", ref
        );

        RemoteEntry entry;
        try {
            JsonNode raw = context.client().getContents(repository.owner(), repository.name(), path, ref);
            entry = entryClassifier.classify(raw, path);
        } catch (GitHubException e) {
            if (e.isNotFound()) {
                eventLogger.warn(SyncLogTag.FETCH_FILE_CONTENTS_ERROR, "Path does not exist", fetchFields);
            } else {
                eventLogger.error(SyncLogTag.FETCH_FILE_CONTENTS_ERROR, "Failed to fetch file contents", fetchFields, e);
            }
            return AbsentEntry.INSTANCE;
        } catch (IOException | RuntimeException e) {
            eventLogger.error(SyncLogTag.FETCH_FILE_CONTENTS_ERROR, "Failed to fetch file contents", fetchFields, e);
            return AbsentEntry.INSTANCE;
        }

        fetchFields.put("type", entry.type().getTypeString());
        entry.contentIdentity().ifPresent(sha -> fetchFields.put("sha", sha));
        eventLogger.info(SyncLogTag.FETCH_FILE_CONTENTS_SUCCESS, "Fetched file contents", fetchFields);

        if (entry.type() == EntryType.ABSENT) {
            eventLogger.warn(SyncLogTag.UNKNOWN_FILE_TYPE, "Contents response has an unknown type", fetchFields);
        }
        return entry;
    }
}
