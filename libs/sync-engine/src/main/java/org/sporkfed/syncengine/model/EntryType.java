package org.sporkfed.syncengine.model;

public enum EntryType {
    FILE,
    SYMLINK,
    SUBMODULE,
    DIRECTORY,
    ABSENT;

    public String getTypeString() {
        return name().toLowerCase();
    }
}
