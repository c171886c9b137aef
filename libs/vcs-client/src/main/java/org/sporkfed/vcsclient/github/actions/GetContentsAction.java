package org.sporkfed.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class GetContentsAction extends GitHubAction {

    private static final Logger log = LoggerFactory.getLogger(GetContentsAction.class);

    public GetContentsAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        super(authorizedOkHttpClient, apiBase);
    }

    /**
     * Fetch the contents payload for a path. A file, symlink or submodule comes back as a single
     * object; a directory comes back as an array of entries.
     *
     * @param ref branch, tag or commit, or {@code null} for the default branch
     */
    public JsonNode getContents(String owner, String repo, String path, String ref) throws IOException {
        String apiUrl = repoUrl(owner, repo) + "/contents/" + encodePath(path);
        if (ref != null && !ref.isBlank()) {
            apiUrl += "?ref=" + encodeQuery(ref);
        }

        Request req = requestBuilder(apiUrl).get().build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                if (resp.code() == 404) {
                    log.debug("Path not found: {} at ref {} (owner: {}, repo: {})", path, ref, owner, repo);
                }
                throw failure("get contents of '" + path + "'", resp);
            }
            return readJson(resp);
        }
    }
}
