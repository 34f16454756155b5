package com.claimrunner.gateway;

import com.claimrunner.shared.config.ClaimRunnerConfig;
import com.claimrunner.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

import java.util.Map;

// the postgres DataSource is built only when that backend is selected
@SpringBootApplication(scanBasePackages = "com.claimrunner.gateway", exclude = DataSourceAutoConfiguration.class)
public class ClaimRunnerApp {

    private static final Logger log = LoggerFactory.getLogger(ClaimRunnerApp.class);

    public static void main(String[] args) {
        ClaimRunnerConfig config;
        try {
            config = ConfigLoader.load().validate();
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        var app = new SpringApplication(ClaimRunnerApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.addInitializers(ctx -> ctx.getBeanFactory().registerSingleton("claimRunnerConfig", config));
        app.run(args);
    }
}
