package org.sporkfed.vcsclient.github.actions;

import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.sporkfed.vcsclient.model.VcsGitRef;

import java.io.IOException;

public class CreateRefAction extends GitHubAction {

    public CreateRefAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        super(authorizedOkHttpClient, apiBase);
    }

    /**
     * @param ref fully qualified reference, e.g. {@code refs/heads/feature}
     * @param sha commit the reference should point at
     */
    public VcsGitRef createRef(String owner, String repo, String ref, String sha) throws IOException {
        String apiUrl = repoUrl(owner, repo) + "/git/refs";

        ObjectNode body = objectMapper.createObjectNode();
        body.put("ref", ref);
        body.put("sha", sha);

        Request req = requestBuilder(apiUrl)
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON_MEDIA_TYPE))
                .build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw failure("create ref " + ref, resp);
            }
            return GetRefAction.parseRef(readJson(resp));
        }
    }
}
