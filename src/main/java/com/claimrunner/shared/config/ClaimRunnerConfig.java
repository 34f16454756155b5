package com.claimrunner.shared.config;

public record ClaimRunnerConfig(
    int serverPort,
    String runSecret,
    WorkerSettings worker,
    StoreConfig store,
    RemoteConfig remote
) {
    /** Fails fast on settings the worker cannot start without. */
    public ClaimRunnerConfig validate() {
        if (remote.apiId() <= 0 || remote.apiHash() == null || remote.apiHash().isBlank()) {
            throw new IllegalStateException(
                    "Missing remote API credentials. Set remote.api-id and remote.api-hash in the config file");
        }
        if (store.backend() == StoreConfig.Backend.POSTGRES
                && (store.url() == null || store.url().isBlank())) {
            throw new IllegalStateException("store.backend=postgres requires store.url");
        }
        if (worker.accountTimeoutSeconds() <= 0) {
            throw new IllegalStateException("worker.account-timeout must be positive");
        }
        return this;
    }

    @Override
    public String toString() {
        return "ClaimRunnerConfig[serverPort=" + serverPort + ", worker=" + worker
                + ", store=" + store + ", remote=" + remote + "]";
    }
}
