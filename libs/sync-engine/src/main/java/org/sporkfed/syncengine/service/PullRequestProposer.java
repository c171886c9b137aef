package org.sporkfed.syncengine.service;

import org.sporkfed.syncengine.logging.SyncEventLogger;
import org.sporkfed.syncengine.logging.SyncLogTag;
import org.sporkfed.syncengine.model.SyncContext;
import org.sporkfed.vcsclient.model.VcsFileCommit;
import org.sporkfed.vcsclient.model.VcsPullRequest;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.sporkfed.syncengine.logging.SyncEventLogger.fields;

/**
 * Writes the new content on the sync branch and opens a pull request into the default branch.
 * <p>
 * Each step runs even if the previous one failed, and nothing is rolled back. Open pull requests
 * for the same head and base are only logged: a duplicate create is left to GitHub to reject.
 */
@Service
public class PullRequestProposer {

    private final SyncEventLogger eventLogger;

    public PullRequestProposer(SyncEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    public void writeAndPropose(
            SyncContext context,
            String branch,
            String defaultBranch,
            String targetPath,
            String newContent,
            String existingSha,
            boolean create
    ) {
        writeAndPropose(context, new SyncProposal(branch, defaultBranch, targetPath, newContent, existingSha, create));
    }

    public void writeAndPropose(SyncContext context, SyncProposal proposal) {
        String message = proposal.commitMessage();
        Map<String, Object> baseFields = fields(
                "repository", context.repository().getFullName(),
                "path", proposal.targetPath(),
                "branch", proposal.branch(),
                "default_branch", proposal.defaultBranch()
        );

        writeContent(context, proposal, message, baseFields);
        logOpenPullRequests(context, proposal, baseFields);
        createPullRequest(context, proposal, message, baseFields);
    }

    private void writeContent(SyncContext context, SyncProposal proposal, String message, Map<String, Object> baseFields) {
        String existingSha = proposal.create() ? null : proposal.existingSha();
        try {
            VcsFileCommit commit = context.client().createOrUpdateFileContents(
                    context.owner(),
                    context.repo(),
                    proposal.targetPath(),
                    stripLineBreaks(proposal.content()),
                    message,
                    proposal.branch(),
                    existingSha
            );
            Map<String, Object> written = fields("content_sha", commit.contentSha(), "commit_sha", commit.commitSha());
            written.putAll(baseFields);
            eventLogger.info(SyncLogTag.UPDATE_TARGET_CONTENT, message, written);
        } catch (IOException | RuntimeException e) {
            eventLogger.error(SyncLogTag.UPDATE_TARGET_CONTENT_ERROR, "Could not write target file", baseFields, e);
        }
    }

    private void logOpenPullRequests(SyncContext context, SyncProposal proposal, Map<String, Object> baseFields) {
        try {
            List<VcsPullRequest> open = context.client().listPullRequests(
                    context.owner(), context.repo(), "open", proposal.defaultBranch(), proposal.branch());
            Map<String, Object> listed = fields("open_pull_requests",
                    open.stream().map(VcsPullRequest::number).toList());
            listed.putAll(baseFields);
            eventLogger.info(SyncLogTag.LIST_PULL_REQUESTS, "Open pull requests for sync branch", listed);
        } catch (IOException | RuntimeException e) {
            eventLogger.error(SyncLogTag.LIST_PULL_REQUESTS, "Could not list open pull requests", baseFields, e);
        }
    }

    private void createPullRequest(SyncContext context, SyncProposal proposal, String title, Map<String, Object> baseFields) {
        try {
            VcsPullRequest pullRequest = context.client().createPullRequest(
                    context.owner(), context.repo(), title, proposal.defaultBranch(), proposal.branch());
            Map<String, Object> created = fields("number", pullRequest.number(), "url", pullRequest.htmlUrl());
            created.putAll(baseFields);
            eventLogger.info(SyncLogTag.CREATE_PULL_REQUEST_SUCCESS, title, created);
        } catch (IOException | RuntimeException e) {
            eventLogger.error(SyncLogTag.CREATE_PULL_REQUEST_ERROR, "Could not create pull request", baseFields, e);
        }
    }

    static String stripLineBreaks(String base64) {
        return base64 == null ? "" : base64.replaceAll("\\s", "");
    }
}
