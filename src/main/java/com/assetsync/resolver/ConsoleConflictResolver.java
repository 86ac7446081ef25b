package com.assetsync.resolver;

import com.assetsync.cli.ConsolePrompt;
import com.assetsync.domain.enums.Direction;
import com.assetsync.domain.model.ComparableField;
import com.assetsync.domain.vo.AssetIdentity;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the operator how to resolve each conflict.
 *
 * <p>Accepts {@code L}/{@code local}, {@code R}/{@code remote}, {@code S}/{@code skip} and
 * {@code A}/{@code abort}, case-insensitively, and asks again on anything else. When stdin is
 * exhausted the conflict is skipped so unattended runs still finish their gap-filling.
 */
public class ConsoleConflictResolver implements ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConsoleConflictResolver.class);

    private final ConsolePrompt consolePrompt;

    public ConsoleConflictResolver(ConsolePrompt consolePrompt) {
        this.consolePrompt = consolePrompt;
    }

    @Override
    public Direction resolve(AssetIdentity identity, ComparableField field, String localValue, String remoteValue) {
        consolePrompt.println("");
        consolePrompt.println(String.format("Conflict for serial %s, field '%s':", identity, field.getLocalName()));
        consolePrompt.println(String.format("  Spreadsheet = '%s'", localValue));
        consolePrompt.println(String.format("  Lansweeper  = '%s'", remoteValue));

        while (true) {
            Optional<String> answer = consolePrompt.ask(
                    "[L] keep spreadsheet value, [R] keep Lansweeper value, [S] skip, [A] abort: ");
            if (answer.isEmpty()) {
                log.warn("No console input for conflict on {} / {}, skipping", identity, field.getLocalName());
                return Direction.SKIP;
            }
            Direction direction = parse(answer.get());
            if (direction != null) {
                log.info("Operator chose {} for {} / {}", direction, identity, field.getLocalName());
                return direction;
            }
            consolePrompt.println("Please answer L, R, S or A.");
        }
    }

    static Direction parse(String answer) {
        return switch (answer.toLowerCase(Locale.ROOT)) {
            case "l", "local" -> Direction.ADOPT_LOCAL;
            case "r", "remote" -> Direction.ADOPT_REMOTE;
            case "s", "skip" -> Direction.SKIP;
            case "a", "abort" -> Direction.ABORT;
            default -> null;
        };
    }
}
