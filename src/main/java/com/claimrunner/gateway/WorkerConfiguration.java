package com.claimrunner.gateway;

import com.claimrunner.auth.RunSecretVerifier;
import com.claimrunner.observability.WorkerMetrics;
import com.claimrunner.remote.BonusClaimAction;
import com.claimrunner.remote.HttpBridgeConnector;
import com.claimrunner.remote.RemoteActionCapability;
import com.claimrunner.sessions.SessionStore;
import com.claimrunner.sessions.SessionStores;
import com.claimrunner.shared.Sleeper;
import com.claimrunner.shared.config.ClaimRunnerConfig;
import com.claimrunner.worker.AccountProcessor;
import com.claimrunner.worker.BatchOrchestrator;
import com.claimrunner.worker.RunGuard;
import com.claimrunner.worker.RunTrigger;
import com.claimrunner.worker.StaleSessionRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class WorkerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkerMetrics workerMetrics() {
        return new WorkerMetrics();
    }

    @Bean
    public SessionStore sessionStore(ClaimRunnerConfig config) {
        return SessionStores.create(config.store());
    }

    @Bean
    public RemoteActionCapability remoteAction(ClaimRunnerConfig config) {
        var remote = config.remote();
        log.info("Remote action: bot {} via bridge {}", remote.botUsername(), remote.bridgeUrl());
        return new BonusClaimAction(new HttpBridgeConnector(remote), remote, Sleeper.SYSTEM);
    }

    @Bean
    public AccountProcessor accountProcessor(SessionStore store, RemoteActionCapability remote,
                                             ClaimRunnerConfig config, WorkerMetrics metrics, Clock clock) {
        return new AccountProcessor(store, remote, config.worker(), metrics, clock, Sleeper.SYSTEM);
    }

    @Bean
    public BatchOrchestrator batchOrchestrator(SessionStore store, AccountProcessor processor,
                                               ClaimRunnerConfig config, WorkerMetrics metrics, Clock clock) {
        return new BatchOrchestrator(store, processor, config.worker(), metrics, clock, Sleeper.SYSTEM);
    }

    @Bean
    public StaleSessionRecovery staleSessionRecovery(SessionStore store, ClaimRunnerConfig config, Clock clock) {
        return new StaleSessionRecovery(store, Duration.ofMinutes(config.worker().staleInProgressMinutes()), clock);
    }

    @Bean
    public RunGuard runGuard(BatchOrchestrator orchestrator, StaleSessionRecovery recovery) {
        // recovery completes before any run can be triggered
        recovery.recover();
        return new RunGuard(orchestrator::runOnce);
    }

    @Bean
    public RunTrigger runTrigger(RunGuard guard, ClaimRunnerConfig config, WorkerMetrics metrics) {
        return new RunTrigger(guard, new RunSecretVerifier(config.runSecret()), metrics);
    }

    @Bean
    public ApplicationRunner startupRun(RunTrigger trigger, ClaimRunnerConfig config) {
        return args -> {
            if (config.worker().runOnStartup()) {
                log.info("run-on-startup enabled, requesting run: {}", trigger.requestRun(null));
            } else {
                log.info("Awaiting /run trigger");
            }
        };
    }
}
