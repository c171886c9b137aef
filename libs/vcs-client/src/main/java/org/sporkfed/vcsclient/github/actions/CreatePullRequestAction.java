package org.sporkfed.vcsclient.github.actions;

import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sporkfed.vcsclient.model.VcsPullRequest;

import java.io.IOException;

public class CreatePullRequestAction extends GitHubAction {

    private static final Logger log = LoggerFactory.getLogger(CreatePullRequestAction.class);

    public CreatePullRequestAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        super(authorizedOkHttpClient, apiBase);
    }

    public VcsPullRequest createPullRequest(
            String owner,
            String repo,
            String title,
            String base,
            String head
    ) throws IOException {
        String apiUrl = repoUrl(owner, repo) + "/pulls";

        ObjectNode body = objectMapper.createObjectNode();
        body.put("title", title);
        body.put("base", base);
        body.put("head", head);

        Request req = requestBuilder(apiUrl)
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON_MEDIA_TYPE))
                .build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw failure("create pull request " + head + " -> " + base, resp);
            }
            VcsPullRequest pullRequest = ListPullRequestsAction.parsePullRequest(readJson(resp));
            log.debug("Created pull request #{} in {}/{}", pullRequest.number(), owner, repo);
            return pullRequest;
        }
    }
}
