package com.chicu.marginoptimizer.runlog;

import com.chicu.marginoptimizer.remote.BlobStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Каждый запуск -> отдельный JSON: {prefix}/runs/{yyyy-MM-dd'T'HH-mm-ss'Z'}.json
 */
@Slf4j
public class BlobRunLogSink implements RunLogSink {

    private static final DateTimeFormatter KEY_TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss'Z'").withZone(ZoneOffset.UTC);

    private final BlobStorage storage;
    private final ObjectMapper om;

    public BlobRunLogSink(BlobStorage storage, ObjectMapper objectMapper) {
        this.storage = storage;
        this.om = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    public static String keyName(RunLogEntry entry) {
        return "runs/" + KEY_TS.format(entry.timestamp()) + ".json";
    }

    @Override
    public boolean record(RunLogEntry entry) {
        String key = storage.keyFor(keyName(entry));
        try {
            byte[] body = om.writeValueAsBytes(entry);
            storage.put(key, body, "application/json");
            log.info("📝 Run log saved: {}", key);
            return true;
        } catch (Exception e) {
            log.warn("⚠️ Failed to save run log {}: {}", key, e.getMessage());
            return false;
        }
    }
}
