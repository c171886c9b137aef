package org.sporkfed.syncengine.model;

public record SyncDecision(
        SyncAction action,
        String reason
) {
    public static SyncDecision noop(String reason) {
        return new SyncDecision(SyncAction.NOOP, reason);
    }

    public static SyncDecision create(String reason) {
        return new SyncDecision(SyncAction.CREATE, reason);
    }

    public static SyncDecision update(String reason) {
        return new SyncDecision(SyncAction.UPDATE, reason);
    }

    public static SyncDecision rejected(String reason) {
        return new SyncDecision(SyncAction.REJECTED, reason);
    }

    public boolean requiresWrite() {
        return action == SyncAction.CREATE || action == SyncAction.UPDATE;
    }
}
