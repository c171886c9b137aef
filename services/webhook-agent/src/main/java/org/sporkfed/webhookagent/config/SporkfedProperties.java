package org.sporkfed.webhookagent.config;

import org.sporkfed.vcsclient.github.GitHubConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "sporkfed")
public class SporkfedProperties {

    private final Github github = new Github();
    private final Executor executor = new Executor();

    public Github getGithub() {
        return github;
    }

    public Executor getExecutor() {
        return executor;
    }

    public static class Github {

        private String apiBase = GitHubConfig.API_BASE;
        private String token;
        private String webhookSecret;
        private final App app = new App();

        public String getApiBase() {
            return apiBase;
        }

        public void setApiBase(String apiBase) {
            this.apiBase = apiBase;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getWebhookSecret() {
            return webhookSecret;
        }

        public void setWebhookSecret(String webhookSecret) {
            this.webhookSecret = webhookSecret;
        }

        public App getApp() {
            return app;
        }
    }

    public static class App {

        private String id;
        private String privateKeyPath;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getPrivateKeyPath() {
            return privateKeyPath;
        }

        public void setPrivateKeyPath(String privateKeyPath) {
            this.privateKeyPath = privateKeyPath;
        }

        public boolean isConfigured() {
            return id != null && !id.isBlank() && privateKeyPath != null && !privateKeyPath.isBlank();
        }
    }

    /**
     * Pool sizes of the webhook and rule executors.
     */
    public static class Executor {

        private int webhookCoreSize = 2;
        private int webhookMaxSize = 4;
        private int webhookQueueCapacity = 100;
        private int ruleCoreSize = 4;
        private int ruleMaxSize = 8;
        private int ruleQueueCapacity = 200;

        public int getWebhookCoreSize() {
            return webhookCoreSize;
        }

        public void setWebhookCoreSize(int webhookCoreSize) {
            this.webhookCoreSize = webhookCoreSize;
        }

        public int getWebhookMaxSize() {
            return webhookMaxSize;
        }

        public void setWebhookMaxSize(int webhookMaxSize) {
            this.webhookMaxSize = webhookMaxSize;
        }

        public int getWebhookQueueCapacity() {
            return webhookQueueCapacity;
        }

        public void setWebhookQueueCapacity(int webhookQueueCapacity) {
            this.webhookQueueCapacity = webhookQueueCapacity;
        }

        public int getRuleCoreSize() {
            return ruleCoreSize;
        }

        public void setRuleCoreSize(int ruleCoreSize) {
            this.ruleCoreSize = ruleCoreSize;
        }

        public int getRuleMaxSize() {
            return ruleMaxSize;
        }

        public void setRuleMaxSize(int ruleMaxSize) {
            this.ruleMaxSize = ruleMaxSize;
        }

        public int getRuleQueueCapacity() {
            return ruleQueueCapacity;
        }

        public void setRuleQueueCapacity(int ruleQueueCapacity) {
            this.ruleQueueCapacity = ruleQueueCapacity;
        }
    }
}
