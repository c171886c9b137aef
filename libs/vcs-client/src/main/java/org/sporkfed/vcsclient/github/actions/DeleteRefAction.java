package org.sporkfed.vcsclient.github.actions;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

public class DeleteRefAction extends GitHubAction {

    public DeleteRefAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        super(authorizedOkHttpClient, apiBase);
    }

    /**
     * @param ref reference without the {@code refs/} prefix, e.g. {@code heads/feature}
     */
    public void deleteRef(String owner, String repo, String ref) throws IOException {
        String apiUrl = repoUrl(owner, repo) + "/git/refs/" + encodePath(ref);

        Request req = requestBuilder(apiUrl).delete().build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw failure("delete ref " + ref, resp);
            }
        }
    }
}
