package org.sporkfed.vcsclient.github;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import org.sporkfed.vcsclient.VcsClient;
import org.sporkfed.vcsclient.github.actions.CreateOrUpdateFileContentsAction;
import org.sporkfed.vcsclient.github.actions.CreatePullRequestAction;
import org.sporkfed.vcsclient.github.actions.CreateRefAction;
import org.sporkfed.vcsclient.github.actions.DeleteRefAction;
import org.sporkfed.vcsclient.github.actions.GetContentsAction;
import org.sporkfed.vcsclient.github.actions.GetRefAction;
import org.sporkfed.vcsclient.github.actions.ListPullRequestsAction;
import org.sporkfed.vcsclient.model.VcsFileCommit;
import org.sporkfed.vcsclient.model.VcsGitRef;
import org.sporkfed.vcsclient.model.VcsPullRequest;

import java.io.IOException;
import java.util.List;

/**
 * VcsClient implementation for the GitHub REST API.
 * The OkHttpClient passed in is expected to add the authorization header, see
 * {@link org.sporkfed.vcsclient.HttpAuthorizedClientFactory}.
 */
public class GitHubClient implements VcsClient {

    private final GetContentsAction getContentsAction;
    private final GetRefAction getRefAction;
    private final DeleteRefAction deleteRefAction;
    private final CreateRefAction createRefAction;
    private final CreateOrUpdateFileContentsAction createOrUpdateFileContentsAction;
    private final ListPullRequestsAction listPullRequestsAction;
    private final CreatePullRequestAction createPullRequestAction;

    public GitHubClient(OkHttpClient httpClient) {
        this(httpClient, GitHubConfig.API_BASE);
    }

    public GitHubClient(OkHttpClient httpClient, String apiBase) {
        this.getContentsAction = new GetContentsAction(httpClient, apiBase);
        this.getRefAction = new GetRefAction(httpClient, apiBase);
        this.deleteRefAction = new DeleteRefAction(httpClient, apiBase);
        this.createRefAction = new CreateRefAction(httpClient, apiBase);
        this.createOrUpdateFileContentsAction = new CreateOrUpdateFileContentsAction(httpClient, apiBase);
        this.listPullRequestsAction = new ListPullRequestsAction(httpClient, apiBase);
        this.createPullRequestAction = new CreatePullRequestAction(httpClient, apiBase);
    }

    @Override
    public JsonNode getContents(String owner, String repo, String path, String ref) throws IOException {
        return getContentsAction.getContents(owner, repo, path, ref);
    }

    @Override
    public VcsGitRef getRef(String owner, String repo, String ref) throws IOException {
        return getRefAction.getRef(owner, repo, ref);
    }

    @Override
    public void deleteRef(String owner, String repo, String ref) throws IOException {
        deleteRefAction.deleteRef(owner, repo, ref);
    }

    @Override
    public VcsGitRef createRef(String owner, String repo, String ref, String sha) throws IOException {
        return createRefAction.createRef(owner, repo, ref, sha);
    }

    @Override
    public VcsFileCommit createOrUpdateFileContents(
            String owner,
            String repo,
            String path,
            String base64Content,
            String message,
            String branch,
            String expectedSha
    ) throws IOException {
        return createOrUpdateFileContentsAction.createOrUpdate(
                owner, repo, path, base64Content, message, branch, expectedSha);
    }

    @Override
    public List<VcsPullRequest> listPullRequests(String owner, String repo, String state, String base, String head)
            throws IOException {
        return listPullRequestsAction.listPullRequests(owner, repo, state, base, head);
    }

    @Override
    public VcsPullRequest createPullRequest(String owner, String repo, String title, String base, String head)
            throws IOException {
        return createPullRequestAction.createPullRequest(owner, repo, title, base, head);
    }
}
