package org.sporkfed.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.sporkfed.vcsclient.github.GitHubConfig;
import org.sporkfed.vcsclient.github.GitHubException;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Shared plumbing for the single-endpoint GitHub actions.
 */
abstract class GitHubAction {

    protected static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");

    protected final OkHttpClient authorizedOkHttpClient;
    protected final String apiBase;
    protected final ObjectMapper objectMapper = new ObjectMapper();

    protected GitHubAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = GitHubConfig.normalizeApiBase(apiBase);
    }

    protected String repoUrl(String owner, String repo) {
        return String.format("%s/repos/%s/%s", apiBase, owner, repo);
    }

    protected Request.Builder requestBuilder(String url) {
        return new Request.Builder()
                .url(url)
                .header("Accept", GitHubConfig.ACCEPT_MEDIA_TYPE)
                .header("X-GitHub-Api-Version", GitHubConfig.API_VERSION);
    }

    protected JsonNode readJson(Response resp) throws IOException {
        String body = resp.body() != null ? resp.body().string() : "";
        return objectMapper.readTree(body);
    }

    protected GitHubException failure(String operation, Response resp) throws IOException {
        String body = resp.body() != null ? resp.body().string() : "";
        return new GitHubException(operation, resp.code(), body);
    }

    /**
     * Encode each path segment but keep the separators, as GitHub expects for contents and refs.
     */
    protected static String encodePath(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String[] segments = path.split("/");
        StringBuilder encoded = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) encoded.append("/");
            encoded.append(URLEncoder.encode(segments[i], StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return encoded.toString();
    }

    protected static String encodeQuery(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    protected static String textOrNull(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }
}
