package org.sporkfed.syncengine.logging;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncEventLoggerTest {

    @Test
    @DisplayName("should keep field order and null values")
    void shouldBuildOrderedFields() {
        Map<String, Object> fields = SyncEventLogger.fields("repository", "octo/site", "ref", null, "count", 2);

        assertThat(fields).containsKeys("repository", "ref", "count");
        assertThat(fields.keySet()).containsExactly("repository", "ref", "count");
        assertThat(fields.get("ref")).isNull();
    }

    @Test
    @DisplayName("should reject an odd number of arguments")
    void shouldRejectOddArguments() {
        assertThatThrownBy(() -> SyncEventLogger.fields("repository"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should emit events with and without a cause")
    void shouldEmitEvents() {
        SyncEventLogger logger = new SyncEventLogger();

        assertThatNoException().isThrownBy(() -> {
            logger.info(SyncLogTag.IGNORE_NO_RULES, "No sync rules configured", SyncEventLogger.fields("repository", "octo/site"));
            logger.warn(SyncLogTag.SOURCE_PATH_NOT_FOUND, "Source path not found", null);
            logger.error(SyncLogTag.RULE_PROCESSING_ERROR, "Rule processing failed", Map.of(), new IllegalStateException("boom"));
        });
    }

    @Test
    @DisplayName("should expose stable tag values")
    void shouldExposeTagValues() {
        assertThat(SyncLogTag.IGNORE_NON_DEFAULT_BRANCH.getValue()).isEqualTo("ignore_non_default_branch");
        assertThat(SyncLogTag.CREATE_PULL_REQUEST_ERROR).hasToString("create_pull_request_error");
    }
}
