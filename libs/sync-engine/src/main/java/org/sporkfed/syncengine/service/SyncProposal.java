package org.sporkfed.syncengine.service;

/**
 * A file write to stage on the sync branch and propose into the default branch.
 *
 * @param content     new body, base64 encoded
 * @param existingSha blob sha of the file being replaced; {@code null} when creating
 */
public record SyncProposal(
        String branch,
        String defaultBranch,
        String targetPath,
        String content,
        String existingSha,
        boolean create
) {
    public String commitMessage() {
        return commitMessage(targetPath, create);
    }

    public static String commitMessage(String targetPath, boolean create) {
        return "sporkfed[bot] " + (create ? "create" : "update") + " file at '" + targetPath + "'";
    }
}
