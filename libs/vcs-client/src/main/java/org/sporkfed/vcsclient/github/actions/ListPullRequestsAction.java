package org.sporkfed.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.sporkfed.vcsclient.github.GitHubConfig;
import org.sporkfed.vcsclient.model.VcsPullRequest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class ListPullRequestsAction extends GitHubAction {

    public ListPullRequestsAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        super(authorizedOkHttpClient, apiBase);
    }

    /**
     * List pull requests filtered by state, base branch and head branch. GitHub filters on
     * {@code owner:branch}; a bare branch name is qualified with the repository owner.
     */
    public List<VcsPullRequest> listPullRequests(
            String owner,
            String repo,
            String state,
            String base,
            String head
    ) throws IOException {
        StringBuilder apiUrl = new StringBuilder(repoUrl(owner, repo))
                .append("/pulls?per_page=").append(GitHubConfig.DEFAULT_PAGE_SIZE);
        if (state != null) {
            apiUrl.append("&state=").append(encodeQuery(state));
        }
        if (base != null) {
            apiUrl.append("&base=").append(encodeQuery(base));
        }
        if (head != null) {
            String qualifiedHead = head.contains(":") ? head : owner + ":" + head;
            apiUrl.append("&head=").append(encodeQuery(qualifiedHead));
        }

        Request req = requestBuilder(apiUrl.toString()).get().build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw failure("list pull requests", resp);
            }
            JsonNode root = readJson(resp);
            List<VcsPullRequest> pullRequests = new ArrayList<>();
            if (root.isArray()) {
                for (JsonNode node : root) {
                    pullRequests.add(parsePullRequest(node));
                }
            }
            return pullRequests;
        }
    }

    static VcsPullRequest parsePullRequest(JsonNode node) {
        return new VcsPullRequest(
                node.path("number").asLong(),
                textOrNull(node, "title"),
                textOrNull(node, "state"),
                node.path("head").path("ref").asText(null),
                node.path("base").path("ref").asText(null),
                textOrNull(node, "html_url")
        );
    }
}
