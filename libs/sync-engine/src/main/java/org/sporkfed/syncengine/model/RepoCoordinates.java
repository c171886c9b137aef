package org.sporkfed.syncengine.model;

public record RepoCoordinates(
        String owner,
        String name
) {
    public String getFullName() {
        return owner + "/" + name;
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
