package org.sporkfed.syncengine.model;

/**
 * Which side of a rule a fetch was made for.
 */
public enum FetchSide {
    SOURCE,
    TARGET;

    public String getLabel() {
        return name().toLowerCase();
    }
}
