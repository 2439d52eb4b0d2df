package com.vigil.runner;

import com.vigil.runner.config.VigilProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Vigil status runner: one invocation runs every configured check once, aggregates the retained
 * history into the status summary and detects incident/recovery transitions, then exits.
 *
 * <p>Meant to be started on a fixed schedule (cron, CI workflow). The process exit code is
 * non-zero when the invocation failed; see {@link StatusInvocation}.
 */
@SpringBootApplication
@EnableConfigurationProperties(VigilProperties.class)
public class StatusRunnerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(StatusRunnerApplication.class, args)));
    }
}
