package org.sporkfed.webhookagent.github.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sporkfed.syncengine.model.PushEvent;
import org.sporkfed.syncengine.model.SyncContext;
import org.sporkfed.syncengine.model.SyncContextFactory;
import org.sporkfed.vcsclient.HttpAuthorizedClientFactory;
import org.sporkfed.vcsclient.VcsClient;
import org.sporkfed.vcsclient.VcsClientException;
import org.sporkfed.vcsclient.github.GitHubAppAuthService;
import org.sporkfed.vcsclient.github.GitHubAppAuthService.InstallationToken;
import org.sporkfed.vcsclient.github.GitHubClient;
import org.sporkfed.webhookagent.config.SporkfedProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provides authorized GitHub clients for push events.
 * <p>
 * Deliveries of a GitHub App installation use an installation access token when the app credentials
 * are configured; all other deliveries use the configured personal token.
 */
@Service
public class GitHubClientProvider implements SyncContextFactory {

    private static final Logger log = LoggerFactory.getLogger(GitHubClientProvider.class);
    private static final Duration TOKEN_REFRESH_MARGIN = Duration.ofMinutes(5);

    private final HttpAuthorizedClientFactory httpClientFactory;
    private final GitHubAppAuthService appAuthService;
    private final String apiBase;
    private final String personalToken;
    private final Map<Long, InstallationToken> installationTokens = new ConcurrentHashMap<>();

    public GitHubClientProvider(SporkfedProperties properties, HttpAuthorizedClientFactory httpClientFactory) {
        this(
                httpClientFactory,
                createAppAuthService(properties.getGithub()),
                properties.getGithub().getApiBase(),
                properties.getGithub().getToken()
        );
    }

    GitHubClientProvider(
            HttpAuthorizedClientFactory httpClientFactory,
            GitHubAppAuthService appAuthService,
            String apiBase,
            String personalToken
    ) {
        this.httpClientFactory = httpClientFactory;
        this.appAuthService = appAuthService;
        this.apiBase = apiBase;
        this.personalToken = personalToken;
    }

    @Override
    public SyncContext create(PushEvent event) {
        return new SyncContext(
                getClient(event.installationId()),
                event.repositoryCoordinates(),
                event.defaultBranch()
        );
    }

    /**
     * @param installationId GitHub App installation of the delivery, or {@code null}
     * @throws VcsClientException if no usable credentials are configured or the token exchange fails
     */
    public VcsClient getClient(Long installationId) {
        if (installationId != null && appAuthService != null) {
            return new GitHubClient(httpClientFactory.createGitHubClient(installationToken(installationId)), apiBase);
        }
        if (personalToken == null || personalToken.isBlank()) {
            throw new VcsClientException("No GitHub credentials configured. Set sporkfed.github.token "
                    + "or sporkfed.github.app.id and sporkfed.github.app.private-key-path");
        }
        return new GitHubClient(httpClientFactory.createGitHubClient(personalToken), apiBase);
    }

    private String installationToken(long installationId) {
        InstallationToken cached = installationTokens.get(installationId);
        if (cached != null && !cached.expiresWithin(TOKEN_REFRESH_MARGIN)) {
            return cached.token();
        }
        try {
            InstallationToken fresh = appAuthService.getInstallationAccessToken(installationId);
            installationTokens.put(installationId, fresh);
            log.info("Refreshed installation token for installation {}, expires at {}",
                    installationId, fresh.expiresAt());
            return fresh.token();
        } catch (IOException e) {
            throw new VcsClientException("Failed to get installation token for installation: " + installationId, e);
        }
    }

    private static GitHubAppAuthService createAppAuthService(SporkfedProperties.Github github) {
        if (!github.getApp().isConfigured()) {
            log.info("GitHub App credentials not configured, using personal token only");
            return null;
        }
        try {
            return GitHubAppAuthService.fromPrivateKeyFile(
                    github.getApp().getId(), github.getApp().getPrivateKeyPath(), github.getApiBase());
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to load GitHub App private key from "
                    + github.getApp().getPrivateKeyPath(), e);
        }
    }
}
