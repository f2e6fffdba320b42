package com.trustgate.steering.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustgate.common.model.DenialEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSON-lines record of every permission denial ({@code <data-dir>/denials.jsonl}).
 * Write failures are logged; the denial itself has already been decided.
 */
@Component
public class DenialAuditLog {

    private static final Logger log = LoggerFactory.getLogger(DenialAuditLog.class);

    static final String FILE_NAME = "denials.jsonl";

    private final ObjectMapper objectMapper;
    private final Path file;

    public DenialAuditLog(ObjectMapper objectMapper, @Value("${trust.data-dir:./data}") String dataDir) {
        this.objectMapper = objectMapper;
        this.file         = Paths.get(dataDir).resolve(FILE_NAME);
    }

    public synchronized void append(DenialEvent event) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, objectMapper.writeValueAsString(event) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("[DenialAudit] append failed. file={} action={}", file, event.action(), e);
        }
    }

    /** Most recent {@code limit} entries, oldest first. Unreadable lines are skipped. */
    public synchronized List<DenialEvent> recent(int limit) {
        if (limit <= 0 || !Files.isRegularFile(file)) return List.of();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("[DenialAudit] read failed. file={}", file, e);
            return List.of();
        }

        List<DenialEvent> out = new ArrayList<>();
        for (String line : lines.subList(Math.max(0, lines.size() - limit), lines.size())) {
            if (line.isBlank()) continue;
            try {
                out.add(objectMapper.readValue(line, DenialEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("[DenialAudit] skipping malformed line: {}", e.getOriginalMessage());
            }
        }
        return out;
    }

    public Path file() {
        return file;
    }
}
