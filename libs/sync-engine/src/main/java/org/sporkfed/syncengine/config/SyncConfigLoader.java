package org.sporkfed.syncengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.sporkfed.syncengine.logging.SyncEventLogger;
import org.sporkfed.syncengine.logging.SyncLogTag;
import org.sporkfed.syncengine.model.SyncContext;
import org.sporkfed.vcsclient.github.GitHubException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.sporkfed.syncengine.logging.SyncEventLogger.fields;

/**
 * Reads the rule file from the default branch of the pushed repository.
 * A missing file means no rules; so does an unreadable one, after it has been logged.
 */
@Service
public class SyncConfigLoader {

    public static final String DEFAULT_CONFIG_PATH = ".github/sporkfed.yml";

    private final SyncEventLogger eventLogger;
    private final String configPath;
    private final ObjectMapper yamlMapper;

    public SyncConfigLoader(
            SyncEventLogger eventLogger,
            @Value("${sporkfed.config-path:" + DEFAULT_CONFIG_PATH + "}") String configPath
    ) {
        this.eventLogger = eventLogger;
        this.configPath = configPath;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String getConfigPath() {
        return configPath;
    }

    public SyncConfig load(SyncContext context) {
        JsonNode contents;
        try {
            contents = context.client().getContents(context.owner(), context.repo(), configPath, context.defaultBranch());
        } catch (GitHubException e) {
            if (e.isNotFound()) {
                return SyncConfig.empty();
            }
            logLoadError(context, "Could not fetch configuration", e);
            return SyncConfig.empty();
        } catch (IOException | RuntimeException e) {
            logLoadError(context, "Could not fetch configuration", e);
            return SyncConfig.empty();
        }

        SyncConfig config;
        try {
            config = parse(contents);
        } catch (IOException | IllegalArgumentException e) {
            logLoadError(context, "Configuration is not valid YAML", e);
            return SyncConfig.empty();
        }

        if (config.version() != null && !SyncConfig.VERSION_1.equals(config.version())) {
            eventLogger.warn(SyncLogTag.UNSUPPORTED_CONFIG_VERSION, "Configuration version is not supported",
                    fields("repository", context.repository().getFullName(), "path", configPath,
                            "version", config.version()));
            return SyncConfig.empty();
        }

        return new SyncConfig(SyncConfig.VERSION_1, validRules(context, config.rules()));
    }

    private SyncConfig parse(JsonNode contents) throws IOException {
        if (contents == null || contents.isArray() || !"file".equals(contents.path("type").asText())) {
            throw new IllegalArgumentException(configPath + " is not a regular file");
        }
        String encoded = contents.path("content").asText("");
        String yaml = new String(Base64.getMimeDecoder().decode(encoded), StandardCharsets.UTF_8);
        if (yaml.isBlank()) {
            return SyncConfig.empty();
        }
        SyncConfig config = yamlMapper.readValue(yaml, SyncConfig.class);
        return config != null ? config : SyncConfig.empty();
    }

    private List<SyncRule> validRules(SyncContext context, List<SyncRule> rules) {
        List<SyncRule> valid = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            SyncRule rule = rules.get(i);
            String problem = rule == null ? "rule is empty" : rule.validate();
            if (problem != null) {
                eventLogger.warn(SyncLogTag.INVALID_RULE, "Skipping invalid rule",
                        fields("repository", context.repository().getFullName(), "index", i, "problem", problem));
                continue;
            }
            valid.add(rule);
        }
        return valid;
    }

    private void logLoadError(SyncContext context, String message, Exception e) {
        eventLogger.error(SyncLogTag.LOAD_CONFIG_ERROR, message,
                fields("repository", context.repository().getFullName(), "path", configPath), e);
    }
}
