package org.sporkfed.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.sporkfed.vcsclient.model.VcsGitRef;

import java.io.IOException;

public class GetRefAction extends GitHubAction {

    public GetRefAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        super(authorizedOkHttpClient, apiBase);
    }

    /**
     * @param ref reference without the {@code refs/} prefix, e.g. {@code heads/main}
     */
    public VcsGitRef getRef(String owner, String repo, String ref) throws IOException {
        String apiUrl = repoUrl(owner, repo) + "/git/ref/" + encodePath(ref);

        Request req = requestBuilder(apiUrl).get().build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw failure("get ref " + ref, resp);
            }
            return parseRef(readJson(resp));
        }
    }

    static VcsGitRef parseRef(JsonNode node) {
        JsonNode object = node.path("object");
        return new VcsGitRef(textOrNull(node, "ref"), object.path("sha").asText(null));
    }
}
