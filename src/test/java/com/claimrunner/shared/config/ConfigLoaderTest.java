package com.claimrunner.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileYieldsDefaults() {
        var config = ConfigLoader.load(tempDir.resolve("absent.yaml"), Map.of());

        assertEquals(3000, config.serverPort());
        assertEquals("default-secret", config.runSecret());
        assertEquals(WorkerSettings.defaults(), config.worker());
        assertEquals(StoreConfig.Backend.FILE, config.store().backend());
        assertEquals("./sessions.json", config.store().file());
        assertEquals("@CatStarssRobot", config.remote().botUsername());
        assertEquals(5, config.remote().messageLimit());
    }

    @Test
    void emptyFileYieldsDefaults() throws Exception {
        var file = Files.writeString(tempDir.resolve("config.yaml"), "");

        assertEquals(3000, ConfigLoader.load(file, Map.of()).serverPort());
    }

    @Test
    void readsEverySection() throws Exception {
        var file = Files.writeString(tempDir.resolve("config.yaml"), """
                server:
                  port: 8088
                trigger:
                  secret: hunter2
                worker:
                  delay-between-accounts: 3
                  eligibility-minutes: 120
                  account-timeout: 45
                  stale-in-progress-minutes: 15
                  flood-wait-margin: 5
                  run-on-startup: true
                store:
                  backend: supabase
                  url: jdbc:postgresql://db:5432/claims
                  username: worker
                  password: pw
                remote:
                  bridge-url: http://bridge:9000
                  api-id: 12345
                  api-hash: abcdef
                  bot-username: "@OtherBot"
                  bonus-label: Bonus
                  subscription-label: Subscribed
                  settle-seconds: 2
                  message-limit: 8
                """);

        var config = ConfigLoader.load(file, Map.of());

        assertEquals(8088, config.serverPort());
        assertEquals("hunter2", config.runSecret());
        assertEquals(new WorkerSettings(3, 120, 45, 15, 5, true), config.worker());
        assertEquals(StoreConfig.Backend.POSTGRES, config.store().backend());
        assertEquals("jdbc:postgresql://db:5432/claims", config.store().url());
        assertEquals("worker", config.store().username());
        assertEquals(new RemoteConfig("http://bridge:9000", 12345, "abcdef", "@OtherBot",
                "Bonus", "Subscribed", 2, 8), config.remote());
    }

    @Test
    void environmentOverridesFile() throws Exception {
        var file = Files.writeString(tempDir.resolve("config.yaml"), """
                server:
                  port: 8088
                worker:
                  eligibility-minutes: 120
                """);
        var env = Map.of(
                "CLAIMRUNNER_PORT", "9090",
                "CLAIMRUNNER_RUN_SECRET", "from-env",
                "CLAIMRUNNER_ELIGIBILITY_MINUTES", "30",
                "CLAIMRUNNER_STORE", "local",
                "CLAIMRUNNER_SESSIONS_FILE", "/data/sessions.json",
                "CLAIMRUNNER_API_ID", "7",
                "CLAIMRUNNER_API_HASH", "hash");

        var config = ConfigLoader.load(file, env);

        assertEquals(9090, config.serverPort());
        assertEquals("from-env", config.runSecret());
        assertEquals(30, config.worker().eligibilityMinutes());
        assertEquals(StoreConfig.Backend.FILE, config.store().backend());
        assertEquals("/data/sessions.json", config.store().file());
        assertEquals(7, config.remote().apiId());
        assertDoesNotThrow(config::validate);
    }

    @Test
    void unknownBackendIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> StoreConfig.Backend.parse("mongo"));
    }

    @Test
    void validateRequiresRemoteCredentials() {
        var config = ConfigLoader.load(tempDir.resolve("absent.yaml"), Map.of());

        var e = assertThrows(IllegalStateException.class, config::validate);
        assertTrue(e.getMessage().contains("api-id"));
    }

    @Test
    void validateRequiresUrlForPostgres() {
        var config = ConfigLoader.load(tempDir.resolve("absent.yaml"), Map.of(
                "CLAIMRUNNER_API_ID", "7",
                "CLAIMRUNNER_API_HASH", "hash",
                "CLAIMRUNNER_STORE", "postgres"));

        assertThrows(IllegalStateException.class, config::validate);
    }

    @Test
    void secretsStayOutOfToString() {
        var config = ConfigLoader.load(tempDir.resolve("absent.yaml"), Map.of(
                "CLAIMRUNNER_RUN_SECRET", "top-secret-token",
                "CLAIMRUNNER_DB_PASS", "db-password"));

        assertFalse(config.toString().contains("top-secret-token"));
        assertFalse(config.toString().contains("db-password"));
    }
}
