package com.claimrunner.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".claimrunner", "config.yaml"
    );

    public static ClaimRunnerConfig load() {
        var override = System.getenv("CLAIMRUNNER_CONFIG");
        var path = override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH;
        return load(path, System.getenv());
    }

    public static ClaimRunnerConfig load(Path path) {
        return load(path, Map.of());
    }

    @SuppressWarnings("unchecked")
    static ClaimRunnerConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var trigger = (Map<String, Object>) raw.getOrDefault("trigger", Map.of());
        var worker = (Map<String, Object>) raw.getOrDefault("worker", Map.of());
        var store = (Map<String, Object>) raw.getOrDefault("store", Map.of());
        var remote = (Map<String, Object>) raw.getOrDefault("remote", Map.of());

        return new ClaimRunnerConfig(
            Integer.parseInt(envOrDefault(env, "CLAIMRUNNER_PORT",
                String.valueOf(server.getOrDefault("port", 3000)))),
            envOrDefault(env, "CLAIMRUNNER_RUN_SECRET",
                String.valueOf(trigger.getOrDefault("secret", "default-secret"))),
            parseWorker(worker, env),
            parseStore(store, env),
            parseRemote(remote, env)
        );
    }

    private static WorkerSettings parseWorker(Map<String, Object> worker, Map<String, String> env) {
        var defaults = WorkerSettings.defaults();
        return new WorkerSettings(
            Long.parseLong(envOrDefault(env, "CLAIMRUNNER_DELAY_BETWEEN_ACCOUNTS",
                String.valueOf(worker.getOrDefault("delay-between-accounts", defaults.delayBetweenAccountsSeconds())))),
            Long.parseLong(envOrDefault(env, "CLAIMRUNNER_ELIGIBILITY_MINUTES",
                String.valueOf(worker.getOrDefault("eligibility-minutes", defaults.eligibilityMinutes())))),
            Long.parseLong(envOrDefault(env, "CLAIMRUNNER_ACCOUNT_TIMEOUT",
                String.valueOf(worker.getOrDefault("account-timeout", defaults.accountTimeoutSeconds())))),
            Long.parseLong(String.valueOf(
                worker.getOrDefault("stale-in-progress-minutes", defaults.staleInProgressMinutes()))),
            Long.parseLong(String.valueOf(
                worker.getOrDefault("flood-wait-margin", defaults.floodWaitMarginSeconds()))),
            Boolean.parseBoolean(envOrDefault(env, "CLAIMRUNNER_RUN_ON_STARTUP",
                String.valueOf(worker.getOrDefault("run-on-startup", defaults.runOnStartup()))))
        );
    }

    private static StoreConfig parseStore(Map<String, Object> store, Map<String, String> env) {
        var defaults = StoreConfig.defaults();
        return new StoreConfig(
            StoreConfig.Backend.parse(envOrDefault(env, "CLAIMRUNNER_STORE",
                String.valueOf(store.getOrDefault("backend", "file")))),
            envOrDefault(env, "CLAIMRUNNER_SESSIONS_FILE",
                String.valueOf(store.getOrDefault("file", defaults.file()))),
            envOrDefault(env, "CLAIMRUNNER_DB_URL",
                String.valueOf(store.getOrDefault("url", defaults.url()))),
            envOrDefault(env, "CLAIMRUNNER_DB_USER",
                String.valueOf(store.getOrDefault("username", defaults.username()))),
            envOrDefault(env, "CLAIMRUNNER_DB_PASS",
                String.valueOf(store.getOrDefault("password", defaults.password())))
        );
    }

    private static RemoteConfig parseRemote(Map<String, Object> remote, Map<String, String> env) {
        var defaults = RemoteConfig.defaults();
        return new RemoteConfig(
            envOrDefault(env, "CLAIMRUNNER_BRIDGE_URL",
                String.valueOf(remote.getOrDefault("bridge-url", defaults.bridgeUrl()))),
            Integer.parseInt(envOrDefault(env, "CLAIMRUNNER_API_ID",
                String.valueOf(remote.getOrDefault("api-id", defaults.apiId())))),
            envOrDefault(env, "CLAIMRUNNER_API_HASH",
                String.valueOf(remote.getOrDefault("api-hash", defaults.apiHash()))),
            envOrDefault(env, "CLAIMRUNNER_BOT_USERNAME",
                String.valueOf(remote.getOrDefault("bot-username", defaults.botUsername()))),
            String.valueOf(remote.getOrDefault("bonus-label", defaults.bonusLabel())),
            String.valueOf(remote.getOrDefault("subscription-label", defaults.subscriptionLabel())),
            Long.parseLong(String.valueOf(remote.getOrDefault("settle-seconds", defaults.settleSeconds()))),
            Integer.parseInt(String.valueOf(remote.getOrDefault("message-limit", defaults.messageLimit())))
        );
    }

    private static String envOrDefault(Map<String, String> env, String name, String fallback) {
        var val = env.get(name);
        return val != null ? val : fallback;
    }
}
