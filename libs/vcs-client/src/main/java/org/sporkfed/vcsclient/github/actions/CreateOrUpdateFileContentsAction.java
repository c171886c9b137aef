package org.sporkfed.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.sporkfed.vcsclient.model.VcsFileCommit;

import java.io.IOException;

public class CreateOrUpdateFileContentsAction extends GitHubAction {

    public CreateOrUpdateFileContentsAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        super(authorizedOkHttpClient, apiBase);
    }

    /**
     * Write a file on a branch. When {@code expectedSha} is set GitHub rejects the write with 409
     * if the file on the branch no longer has that blob sha.
     */
    public VcsFileCommit createOrUpdate(
            String owner,
            String repo,
            String path,
            String base64Content,
            String message,
            String branch,
            String expectedSha
    ) throws IOException {
        String apiUrl = repoUrl(owner, repo) + "/contents/" + encodePath(path);

        ObjectNode body = objectMapper.createObjectNode();
        body.put("message", message);
        body.put("content", base64Content);
        if (branch != null) {
            body.put("branch", branch);
        }
        if (expectedSha != null) {
            body.put("sha", expectedSha);
        }

        Request req = requestBuilder(apiUrl)
                .put(RequestBody.create(objectMapper.writeValueAsString(body), JSON_MEDIA_TYPE))
                .build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw failure("write file '" + path + "'", resp);
            }
            JsonNode root = readJson(resp);
            JsonNode content = root.path("content");
            JsonNode commit = root.path("commit");
            return new VcsFileCommit(
                    content.path("path").asText(path),
                    content.path("sha").asText(null),
                    commit.path("sha").asText(null)
            );
        }
    }
}
