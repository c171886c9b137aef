package org.sporkfed.syncengine.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits tagged, structured log events for sync decision points.
 * <p>
 * The tag and every field are attached as SLF4J key/value pairs; the tag is also prefixed to the
 * message so it survives plain-text layouts.
 */
@Component
public class SyncEventLogger {

    private static final Logger log = LoggerFactory.getLogger("org.sporkfed.sync.events");

    public void info(SyncLogTag tag, String message, Map<String, ?> fields) {
        emit(log.atInfo(), tag, message, fields);
    }

    public void warn(SyncLogTag tag, String message, Map<String, ?> fields) {
        emit(log.atWarn(), tag, message, fields);
    }

    public void error(SyncLogTag tag, String message, Map<String, ?> fields, Throwable cause) {
        LoggingEventBuilder builder = log.atError();
        if (cause != null) {
            builder = builder.setCause(cause);
        }
        emit(builder, tag, message, fields);
    }

    private void emit(LoggingEventBuilder builder, SyncLogTag tag, String message, Map<String, ?> fields) {
        LoggingEventBuilder event = builder.addKeyValue("tag", tag.getValue());
        if (fields != null) {
            for (Map.Entry<String, ?> field : fields.entrySet()) {
                event = event.addKeyValue(field.getKey(), field.getValue());
            }
        }
        event.log("[{}] {}", tag.getValue(), message);
    }

    /**
     * Build an ordered field map from alternating keys and values. Null values are kept.
     */
    public static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating keys and values");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return fields;
    }
}
