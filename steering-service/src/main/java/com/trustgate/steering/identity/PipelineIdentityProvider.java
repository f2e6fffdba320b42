package com.trustgate.steering.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustgate.common.exception.IdentityLoadException;
import com.trustgate.common.identity.IdentityProvider;
import com.trustgate.common.model.Identity;
import com.trustgate.common.model.TrustCategory;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Loads the trust identity from the newest trust-pipeline run.
 *
 * <p>Layout: {@code <data-dir>/pipeline-runs/run-<timestamp>/4-grades-statistics.json}. Run
 * directories sort lexicographically by timestamp, so the last one is the newest.
 *
 * <p>Each entry under {@code categories} contributes its numeric {@code score} when present,
 * otherwise its letter {@code grade}. Sovereignty is the mean of the mapped categories.
 * When no run exists the provider serves permissive defaults (every value 0.7) so a fresh
 * install can still act on low-risk work.
 *
 * <p>{@link #get()} only reads an {@link AtomicReference}; the filesystem is touched on
 * {@link #reload()} alone.
 */
@Component
public class PipelineIdentityProvider implements IdentityProvider {

    private static final Logger log = LoggerFactory.getLogger(PipelineIdentityProvider.class);

    static final String RUNS_DIR    = "pipeline-runs";
    static final String RUN_PREFIX  = "run-";
    static final String GRADES_FILE = "4-grades-statistics.json";

    static final double PERMISSIVE_DEFAULT = 0.7;
    static final double UNGRADED_DEFAULT   = 0.6;
    static final double EMPTY_SOVEREIGNTY  = 0.5;

    private static final Map<String, Double> GRADE_SCORES = Map.ofEntries(
        Map.entry("A+", 1.0),  Map.entry("A", 0.95), Map.entry("A-", 0.9),
        Map.entry("B+", 0.85), Map.entry("B", 0.8),  Map.entry("B-", 0.75),
        Map.entry("C+", 0.65), Map.entry("C", 0.6),  Map.entry("C-", 0.55),
        Map.entry("D+", 0.45), Map.entry("D", 0.4),  Map.entry("D-", 0.35),
        Map.entry("F", 0.2)
    );

    private final ObjectMapper objectMapper;
    private final Path dataDir;
    private final Clock clock;

    private final AtomicReference<Identity> current = new AtomicReference<>();
    private final AtomicReference<String>   source  = new AtomicReference<>("defaults");

    public PipelineIdentityProvider(ObjectMapper objectMapper,
                                    @Value("${trust.data-dir:./data}") String dataDir,
                                    Clock clock) {
        this.objectMapper = objectMapper;
        this.dataDir      = Paths.get(dataDir);
        this.clock        = clock;
    }

    /** Startup load. A malformed run file falls back to permissive defaults instead of failing boot. */
    @PostConstruct
    public void init() {
        try {
            reload();
        } catch (IdentityLoadException e) {
            log.error("[PipelineIdentity] startup load failed, serving permissive defaults", e);
            current.set(permissiveDefaults());
            source.set("defaults");
        }
    }

    @Override
    public Identity get() {
        Identity identity = current.get();
        return identity != null ? identity : permissiveDefaults();
    }

    @Override
    public Identity reload() {
        Optional<Path> latest = latestRun();
        if (latest.isEmpty()) {
            log.warn("[PipelineIdentity] NO_PIPELINE_RUNS dir={} using permissive defaults", dataDir.resolve(RUNS_DIR));
            Identity defaults = permissiveDefaults();
            current.set(defaults);
            source.set("defaults");
            return defaults;
        }

        Path run = latest.get();
        Identity loaded = parse(run.resolve(GRADES_FILE));
        current.set(loaded);
        source.set(run.getFileName().toString());
        log.info("[PipelineIdentity] IDENTITY_LOADED run={} sovereignty={}",
            run.getFileName(), String.format("%.3f", loaded.sovereignty()));
        return loaded;
    }

    /** Name of the run the current identity came from, or {@code "defaults"}. */
    public String source() {
        return source.get();
    }

    Optional<Path> latestRun() {
        Path runs = dataDir.resolve(RUNS_DIR);
        if (!Files.isDirectory(runs)) return Optional.empty();
        try (Stream<Path> children = Files.list(runs)) {
            return children
                .filter(Files::isDirectory)
                .filter(p -> p.getFileName().toString().startsWith(RUN_PREFIX))
                .filter(p -> Files.isRegularFile(p.resolve(GRADES_FILE)))
                .max(Comparator.comparing(p -> p.getFileName().toString()));
        } catch (IOException e) {
            throw new IdentityLoadException("Cannot list " + runs, e);
        }
    }

    Identity parse(Path gradesFile) {
        JsonNode root;
        try {
            root = objectMapper.readTree(gradesFile.toFile());
        } catch (IOException e) {
            throw new IdentityLoadException("Cannot read " + gradesFile, e);
        }

        Map<TrustCategory, Double> scores = new EnumMap<>(TrustCategory.class);
        JsonNode categories = root.path("categories");
        Iterator<Map.Entry<String, JsonNode>> fields = categories.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<TrustCategory> category = TrustCategory.fromKey(field.getKey());
            if (category.isEmpty()) {
                log.debug("[PipelineIdentity] ignoring unknown category '{}'", field.getKey());
                continue;
            }
            scores.put(category.get(), clamp(scoreOf(field.getValue())));
        }

        double sovereignty = scores.isEmpty()
            ? EMPTY_SOVEREIGNTY
            : scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(EMPTY_SOVEREIGNTY);

        try {
            return new Identity(scores, sovereignty, clock.instant());
        } catch (IllegalArgumentException e) {
            throw new IdentityLoadException("Invalid identity in " + gradesFile + ": " + e.getMessage(), e);
        }
    }

    static double scoreOf(JsonNode entry) {
        JsonNode score = entry.get("score");
        if (score != null && score.isNumber()) return score.asDouble();
        JsonNode grade = entry.get("grade");
        String letter = grade != null && grade.isTextual() ? grade.asText().trim().toUpperCase() : "C";
        return GRADE_SCORES.getOrDefault(letter, UNGRADED_DEFAULT);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private Identity permissiveDefaults() {
        Map<TrustCategory, Double> scores = new EnumMap<>(TrustCategory.class);
        for (TrustCategory c : TrustCategory.values()) {
            scores.put(c, PERMISSIVE_DEFAULT);
        }
        return new Identity(scores, PERMISSIVE_DEFAULT, clock.instant());
    }
}
