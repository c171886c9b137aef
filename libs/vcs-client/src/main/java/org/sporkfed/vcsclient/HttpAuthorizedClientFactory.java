package org.sporkfed.vcsclient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.sporkfed.vcsclient.github.GitHubConfig;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class HttpAuthorizedClientFactory {

    private final OkHttpClient baseClient = new OkHttpClient.Builder()
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(60, TimeUnit.SECONDS)
            .writeTimeout(60, TimeUnit.SECONDS)
            .build();

    /**
     * Create an OkHttpClient configured for the GitHub API with bearer token authentication.
     *
     * @param accessToken a personal access token or a GitHub App installation token
     * @return OkHttpClient for the GitHub API, sharing the connection pool and dispatcher of every
     *         other client this factory creates
     */
    public OkHttpClient createGitHubClient(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }

        return baseClient.newBuilder()
                .addInterceptor(chain -> {
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header("Authorization", "Bearer " + accessToken)
                            .header("Accept", GitHubConfig.ACCEPT_MEDIA_TYPE)
                            .header("X-GitHub-Api-Version", GitHubConfig.API_VERSION)
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }
}
