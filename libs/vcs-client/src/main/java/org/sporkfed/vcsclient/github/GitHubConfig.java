package org.sporkfed.vcsclient.github;

public final class GitHubConfig {

    public static final String API_BASE = "https://api.github.com";
    public static final String API_VERSION = "2022-11-28";
    public static final String ACCEPT_MEDIA_TYPE = "application/vnd.github+json";

    public static final int DEFAULT_PAGE_SIZE = 30;

    private GitHubConfig() {
        // Utility class
    }

    /**
     * Strip a trailing slash so paths can be appended with a leading one.
     */
    public static String normalizeApiBase(String apiBase) {
        if (apiBase == null || apiBase.isBlank()) {
            return API_BASE;
        }
        return apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
    }
}
