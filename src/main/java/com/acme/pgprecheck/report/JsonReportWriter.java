package com.acme.pgprecheck.report;

import com.acme.pgprecheck.PrecheckContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Machine-readable copy of the report. Never contains the password. */
public final class JsonReportWriter {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonReportWriter() {}

    /** pg_upgrade_precheck_20260101T101500123Z.json */
    public static String defaultFileName(Instant timestamp) {
        return "pg_upgrade_precheck_" + timestamp.toString().replace(":", "").replace(".", "").replace("-", "") + ".json";
    }

    public static Map<String, Object> document(PrecheckContext ctx, PrecheckReport report) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("timestamp_utc", report.summary().finishedAt());
        doc.put("tool", Map.of("name", "pg_upgrade_precheck", "version", "1.0.0"));

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("host", ctx.host);
        inputs.put("port", ctx.port);
        inputs.put("user", ctx.user);
        inputs.put("target_version", ctx.targetVersion);
        doc.put("inputs", inputs);

        doc.put("summary", report.summary());
        doc.put("sections", report.sections());
        return doc;
    }

    public static Path write(PrecheckContext ctx, PrecheckReport report, Path dir) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(defaultFileName(report.summary().finishedAt()));
        MAPPER.writeValue(file.toFile(), document(ctx, report));
        return file;
    }
}
