package com.assetsync.dispatch;

import com.assetsync.cli.ConsolePrompt;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the operator whether to continue. Only {@code y}/{@code yes} continues; exhausted
 * input declines, since there is nobody to confirm the rate limit.
 */
public class ConsoleContinuationGate implements ContinuationGate {

    private static final Logger log = LoggerFactory.getLogger(ConsoleContinuationGate.class);

    private final ConsolePrompt consolePrompt;

    public ConsoleContinuationGate(ConsolePrompt consolePrompt) {
        this.consolePrompt = consolePrompt;
    }

    @Override
    public boolean shouldContinue(long requestsIssued) {
        Optional<String> answer = consolePrompt.ask(String.format(
                "%d requests sent to Lansweeper. Wait for the rate limit window if needed, then continue? [y/N]: ",
                requestsIssued));
        boolean proceed = answer.map(a -> a.toLowerCase(Locale.ROOT))
                .map(a -> a.equals("y") || a.equals("yes"))
                .orElse(false);
        if (!proceed) {
            log.warn("Operator declined to continue after {} requests", requestsIssued);
        }
        return proceed;
    }
}
