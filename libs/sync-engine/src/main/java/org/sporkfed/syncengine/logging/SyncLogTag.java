package org.sporkfed.syncengine.logging;

/**
 * Fixed tags attached to every sync decision log event. Alerting matches on these values,
 * so they must not be renamed.
 */
public enum SyncLogTag {
    IGNORE_NON_DEFAULT_BRANCH("ignore_non_default_branch"),
    IGNORE_NO_HEAD_COMMIT("ignore_no_head_commit"),
    IGNORE_NO_RULES("ignore_no_rules"),
    LOAD_CONFIG_ERROR("load_config_error"),
    UNSUPPORTED_CONFIG_VERSION("unsupported_config_version"),
    INVALID_RULE("invalid_rule"),
    FETCH_FILE_CONTENTS_SUCCESS("fetch_file_contents_success"),
    FETCH_FILE_CONTENTS_ERROR("fetch_file_contents_error"),
    UNKNOWN_FILE_TYPE("unknown_file_type"),
    SOURCE_PATH_NOT_FOUND("source_path_not_found"),
    UNSUPPORTED_SOURCE_TYPE("unsupported_source_type"),
    UNSUPPORTED_SOURCE_ENCODING("unsupported_source_encoding"),
    UNSUPPORTED_TARGET_TYPE("unsupported_target_type"),
    IGNORE_NO_CHANGES("ignore_no_changes"),
    DELETE_BRANCH_ERROR("delete_branch_error"),
    CREATE_BRANCH_ERROR("create_branch_error"),
    UPDATE_TARGET_CONTENT("update_target_content"),
    UPDATE_TARGET_CONTENT_ERROR("update_target_content_error"),
    LIST_PULL_REQUESTS("list_pull_requests"),
    CREATE_PULL_REQUEST_SUCCESS("create_pull_request_success"),
    CREATE_PULL_REQUEST_ERROR("create_pull_request_error"),
    RULE_PROCESSING_ERROR("rule_processing_error");

    private final String value;

    SyncLogTag(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
