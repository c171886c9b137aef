package org.sporkfed.syncengine.model;

import java.util.Optional;

/**
 * What a repository path resolved to when it was fetched.
 * <p>
 * The set of variants is closed: every contents response is mapped onto exactly one of them once,
 * when it is fetched, and the rest of the engine only switches over {@link #type()}.
 */
public sealed interface RemoteEntry permits LeafEntry, DirectoryEntry, AbsentEntry {

    EntryType type();

    /**
     * Content-addressed identity (git blob sha) of the entry. Empty for directories and for
     * {@link AbsentEntry}, so an absent entry never matches a real identity.
     */
    Optional<String> contentIdentity();
}
