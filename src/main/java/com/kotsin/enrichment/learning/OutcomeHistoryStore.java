package com.kotsin.enrichment.learning;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persists the most recent outcome records as a JSON array, overwritten on each save.
 * A blank path disables persistence.
 */
@Slf4j
@Component
public class OutcomeHistoryStore {

    private static final TypeReference<List<OutcomeRecord>> RECORDS_TYPE = new TypeReference<>() {};

    private final Path file;
    private final int persistLimit;
    private final ObjectMapper objectMapper;

    @Autowired
    public OutcomeHistoryStore(@Value("${learning.history.file:./data/outcome-history.json}") String file,
                               @Value("${learning.history.persist-limit:500}") int persistLimit,
                               ObjectMapper objectMapper) {
        this(file == null || file.isBlank() ? null : Paths.get(file), persistLimit, objectMapper);
    }

    public OutcomeHistoryStore(Path file, int persistLimit, ObjectMapper objectMapper) {
        this.file = file;
        this.persistLimit = persistLimit;
        this.objectMapper = objectMapper;
    }

    /**
     * @return persisted records, oldest first; empty if none or unreadable
     */
    public List<OutcomeRecord> load() {
        if (file == null || !Files.exists(file)) {
            return Collections.emptyList();
        }
        try {
            List<OutcomeRecord> records = objectMapper.readValue(file.toFile(), RECORDS_TYPE);
            log.info("[LEARNING] Loaded {} outcome records from {}", records.size(), file);
            return records;
        } catch (IOException e) {
            log.warn("[LEARNING] Could not load outcome history from {}: {}", file, e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Write the last {@code persistLimit} records. Failures are logged, never thrown.
     */
    public void save(List<OutcomeRecord> records) {
        if (file == null) {
            return;
        }
        List<OutcomeRecord> tail = records.size() > persistLimit
                ? new ArrayList<>(records.subList(records.size() - persistLimit, records.size()))
                : records;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), tail);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("[LEARNING] Saved {} outcome records to {}", tail.size(), file);
        } catch (IOException e) {
            log.warn("[LEARNING] Could not save outcome history to {}: {}", file, e.getMessage());
        }
    }
}
