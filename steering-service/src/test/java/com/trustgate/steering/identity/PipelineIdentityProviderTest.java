package com.trustgate.steering.identity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustgate.common.exception.IdentityLoadException;
import com.trustgate.common.model.Identity;
import com.trustgate.common.model.TrustCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PipelineIdentityProviderTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-02-15T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dataDir;

    private PipelineIdentityProvider provider() {
        return new PipelineIdentityProvider(new ObjectMapper(), dataDir.toString(), FIXED);
    }

    private void writeRun(String run, String json) throws IOException {
        Path dir = dataDir.resolve("pipeline-runs").resolve(run);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("4-grades-statistics.json"), json);
    }

    @Nested
    @DisplayName("no pipeline output")
    class DefaultsTests {

        @Test
        @DisplayName("missing runs directory → permissive 0.7 defaults")
        void permissiveDefaults() {
            PipelineIdentityProvider provider = provider();
            provider.init();

            Identity identity = provider.get();
            assertEquals(0.7, identity.sovereignty());
            assertEquals(0.7, identity.score(TrustCategory.SECURITY));
            assertEquals(20, identity.scores().size());
            assertEquals("defaults", provider.source());
        }

        @Test
        @DisplayName("get() before init never returns null")
        void getBeforeInit() {
            assertNotNull(provider().get());
        }
    }

    @Nested
    @DisplayName("grades file")
    class GradesTests {

        @Test
        @DisplayName("numeric score wins over grade; sovereignty is the mean")
        void scoresAndMean() throws IOException {
            writeRun("run-20260215-120000", """
                {"categories": {
                  "security":     {"grade": "B", "score": 0.8},
                  "code_quality": {"grade": "A"},
                  "Data Integrity": {"grade": "F"},
                  "testing": {}
                }}
                """);
            PipelineIdentityProvider provider = provider();

            Identity identity = provider.reload();

            assertEquals(0.8,  identity.score(TrustCategory.SECURITY));
            assertEquals(0.95, identity.score(TrustCategory.CODE_QUALITY));
            assertEquals(0.2,  identity.score(TrustCategory.DATA_INTEGRITY));
            assertEquals(0.6,  identity.score(TrustCategory.TESTING));
            assertEquals(0.0,  identity.score(TrustCategory.COMPLIANCE));
            assertEquals((0.8 + 0.95 + 0.2 + 0.6) / 4, identity.sovereignty(), 1e-9);
            assertEquals(Instant.parse("2026-02-15T12:00:00Z"), identity.loadedAt());
            assertEquals("run-20260215-120000", provider.source());
        }

        @Test
        @DisplayName("newest run directory wins")
        void newestRun() throws IOException {
            writeRun("run-20260215-120000", "{\"categories\": {\"security\": {\"score\": 0.3}}}");
            writeRun("run-20260215-170000", "{\"categories\": {\"security\": {\"score\": 0.9}}}");
            Files.createDirectories(dataDir.resolve("pipeline-runs").resolve("scratch"));

            Identity identity = provider().reload();

            assertEquals(0.9, identity.score(TrustCategory.SECURITY));
        }

        @Test
        @DisplayName("unknown categories are ignored; no known category → sovereignty 0.5")
        void unknownCategories() throws IOException {
            writeRun("run-1", "{\"categories\": {\"vibes\": {\"score\": 1.0}}}");

            Identity identity = provider().reload();

            assertTrue(identity.scores().isEmpty());
            assertEquals(0.5, identity.sovereignty());
        }

        @Test
        @DisplayName("malformed file on reload → IdentityLoadException, previous identity kept")
        void malformedKeepsPrevious() throws IOException {
            writeRun("run-1", "{\"categories\": {\"security\": {\"score\": 0.9}}}");
            PipelineIdentityProvider provider = provider();
            provider.init();

            writeRun("run-2", "{ not json");

            assertThrows(IdentityLoadException.class, provider::reload);
            assertEquals(0.9, provider.get().score(TrustCategory.SECURITY));
            assertEquals("run-1", provider.source());
        }

        @Test
        @DisplayName("malformed file at startup → permissive defaults")
        void malformedAtStartup() throws IOException {
            writeRun("run-1", "[1, 2");
            PipelineIdentityProvider provider = provider();

            assertDoesNotThrow(provider::init);
            assertEquals(0.7, provider.get().sovereignty());
        }
    }
}
