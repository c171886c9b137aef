package org.sporkfed.syncengine.service;

import org.sporkfed.syncengine.logging.SyncEventLogger;
import org.sporkfed.syncengine.logging.SyncLogTag;
import org.sporkfed.syncengine.model.SyncContext;
import org.sporkfed.vcsclient.model.VcsGitRef;
import org.springframework.stereotype.Service;

import java.io.IOException;

import static org.sporkfed.syncengine.logging.SyncEventLogger.fields;

/**
 * Recreates the sync branch at the tip of the default branch.
 * <p>
 * The branch is deleted and created again on every run instead of being fast-forwarded, so it never
 * carries history from an earlier attempt. Commits pushed to it by hand are lost.
 */
@Service
public class BranchResetService {

    private final SyncEventLogger eventLogger;

    public BranchResetService(SyncEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    /**
     * @return sha of the default-branch commit the sync branch now points at
     * @throws BranchResetException if the default branch tip cannot be read
     */
    public String reset(SyncContext context, String branchName, String defaultBranch) {
        String repository = context.repository().getFullName();

        try {
            context.client().deleteRef(context.owner(), context.repo(), "heads/" + branchName);
        } catch (IOException | RuntimeException e) {
            // a branch that did not exist is as good as a deleted one
            eventLogger.error(SyncLogTag.DELETE_BRANCH_ERROR, "Could not delete sync branch",
                    fields("repository", repository, "branch", branchName), e);
        }

        String baseSha;
        try {
            VcsGitRef defaultRef = context.client().getRef(context.owner(), context.repo(), "heads/" + defaultBranch);
            baseSha = defaultRef.objectSha();
        } catch (IOException | RuntimeException e) {
            eventLogger.error(SyncLogTag.CREATE_BRANCH_ERROR, "Could not read default branch tip",
                    fields("repository", repository, "branch", branchName, "default_branch", defaultBranch), e);
            throw new BranchResetException("Could not read tip of " + defaultBranch + " in " + repository, e);
        }

        try {
            context.client().createRef(context.owner(), context.repo(), "refs/heads/" + branchName, baseSha);
        } catch (IOException | RuntimeException e) {
            eventLogger.error(SyncLogTag.CREATE_BRANCH_ERROR, "Could not create sync branch",
                    fields("repository", repository, "branch", branchName, "sha", baseSha), e);
        }
        return baseSha;
    }
}
