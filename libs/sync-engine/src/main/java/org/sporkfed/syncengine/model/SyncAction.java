package org.sporkfed.syncengine.model;

public enum SyncAction {
    NOOP,
    CREATE,
    UPDATE,
    REJECTED
}
