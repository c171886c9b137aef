package org.sporkfed.syncengine.model;

/**
 * Builds the {@link SyncContext} for a push that passed filtering.
 */
@FunctionalInterface
public interface SyncContextFactory {

    SyncContext create(PushEvent event);
}
