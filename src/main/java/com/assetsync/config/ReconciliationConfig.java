package com.assetsync.config;

import com.assetsync.cli.ConsolePrompt;
import com.assetsync.dispatch.AcceptingContinuationGate;
import com.assetsync.dispatch.ConsoleContinuationGate;
import com.assetsync.dispatch.ContinuationGate;
import com.assetsync.resolver.ConflictResolver;
import com.assetsync.resolver.ConsoleConflictResolver;
import com.assetsync.resolver.PolicyConflictResolver;
import com.assetsync.resolver.SkipConflictResolver;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the conflict resolver and continuation gate from {@code assetsync.conflict.mode}
 * and {@code assetsync.dispatch.gate-mode}. Interactive implementations share one
 * {@link ConsolePrompt} on stdin/stdout.
 */
@Configuration
public class ReconciliationConfig {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationConfig.class);

    @Bean
    public ConsolePrompt consolePrompt() {
        return new ConsolePrompt(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    @Bean
    public ConflictResolver conflictResolver(AssetSyncProperties properties, ConsolePrompt consolePrompt) {
        AssetSyncProperties.Conflict conflict = properties.getConflict();
        log.info("Conflict resolution mode: {}", conflict.getMode());
        return switch (conflict.getMode()) {
            case SKIP -> new SkipConflictResolver();
            case POLICY -> new PolicyConflictResolver(conflict.getPolicy(), conflict.getDefaultDirection());
            case INTERACTIVE -> new ConsoleConflictResolver(consolePrompt);
        };
    }

    @Bean
    public ContinuationGate continuationGate(AssetSyncProperties properties, ConsolePrompt consolePrompt) {
        return switch (properties.getDispatch().getGateMode()) {
            case INTERACTIVE -> new ConsoleContinuationGate(consolePrompt);
            case ACCEPT -> new AcceptingContinuationGate();
        };
    }
}
