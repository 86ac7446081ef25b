package com.assetsync.unit.resolver;

import static org.assertj.core.api.Assertions.assertThat;

import com.assetsync.cli.ConsolePrompt;
import com.assetsync.domain.enums.Direction;
import com.assetsync.domain.model.ComparableField;
import com.assetsync.domain.vo.AssetIdentity;
import com.assetsync.resolver.ConsoleConflictResolver;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for ConsoleConflictResolver covering each answer, re-prompting on invalid input,
 * and the exhausted-input fallback.
 */
class ConsoleConflictResolverTest {

    private static final AssetIdentity SN1 = AssetIdentity.of("SN1");
    private static final ComparableField BARCODE = ComparableField.text("Barcode Number", "barCode");

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private ConsoleConflictResolver resolver(String input) {
        return new ConsoleConflictResolver(new ConsolePrompt(
                new BufferedReader(new StringReader(input)), new PrintStream(output, true, StandardCharsets.UTF_8)));
    }

    private Direction resolve(String input) {
        return resolver(input).resolve(SN1, BARCODE, "BC123", "BC124");
    }

    @Test
    @DisplayName("Single-letter and word answers map to directions")
    void answers() {
        assertThat(resolve("L\n")).isEqualTo(Direction.ADOPT_LOCAL);
        assertThat(resolve("remote\n")).isEqualTo(Direction.ADOPT_REMOTE);
        assertThat(resolve("s\n")).isEqualTo(Direction.SKIP);
        assertThat(resolve(" A \n")).isEqualTo(Direction.ABORT);
    }

    @Test
    @DisplayName("Both values are shown to the operator")
    void showsValues() {
        resolve("s\n");

        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("SN1")
                .contains("Barcode Number")
                .contains("'BC123'")
                .contains("'BC124'");
    }

    @Test
    @DisplayName("Invalid input is asked again")
    void reprompts() {
        assertThat(resolve("x\nkeep\nr\n")).isEqualTo(Direction.ADOPT_REMOTE);
        assertThat(output.toString(StandardCharsets.UTF_8)).contains("Please answer L, R, S or A.");
    }

    @Test
    @DisplayName("Exhausted input skips the conflict")
    void eofSkips() {
        assertThat(resolve("")).isEqualTo(Direction.SKIP);
        assertThat(resolve("x\n")).isEqualTo(Direction.SKIP);
    }
}
