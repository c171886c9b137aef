package org.sporkfed.syncengine.model;

import java.util.Optional;

/**
 * The path does not exist or could not be fetched. Both cases mean "nothing to preserve".
 */
public record AbsentEntry() implements RemoteEntry {

    public static final AbsentEntry INSTANCE = new AbsentEntry();

    @Override
    public EntryType type() {
        return EntryType.ABSENT;
    }

    @Override
    public Optional<String> contentIdentity() {
        return Optional.empty();
    }
}
