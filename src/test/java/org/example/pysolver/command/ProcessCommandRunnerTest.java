package org.example.pysolver.command;

import org.example.pysolver.exception.CommandException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProcessCommandRunner. These run real shell commands.
 */
@DisabledOnOs(OS.WINDOWS)
class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner(10, null);

    @Test
    @DisplayName("should capture stdout and stderr")
    void shouldCaptureOutput() throws CommandException {
        CommandResult result = runner.run(List.of("sh", "-c", "echo out; echo err >&2"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStdout()).isEqualTo("out\n");
        assertThat(result.getStderr()).isEqualTo("err\n");
        assertThat(result.getJson()).isNull();
    }

    @Test
    @DisplayName("should replace bytes that are not UTF-8 instead of failing")
    void shouldTolerateMalformedOutput() throws CommandException {
        CommandResult result = runner.run(List.of("sh", "-c", "printf '\\377ok'"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStdout()).isEqualTo("\uFFFDok");
    }

    @Test
    @DisplayName("should parse JSON output")
    void shouldParseJson() throws CommandException {
        CommandResult result = runner.runJson(List.of("sh", "-c", "echo '[{\"key\": \"six\"}]'"));

        assertThat(result.getJson().isArray()).isTrue();
        assertThat(result.getJson().get(0).get("key").asText()).isEqualTo("six");
    }

    @Test
    @DisplayName("should raise on non-zero exit code")
    void shouldRaiseOnFailure() {
        assertThatThrownBy(() -> runner.run(List.of("sh", "-c", "echo broken >&2; exit 3")))
                .isInstanceOfSatisfying(CommandException.class, e -> {
                    assertThat(e.getReturnCode()).isEqualTo(3);
                    assertThat(e.getStderr()).contains("broken");
                    assertThat(e.isTimeout()).isFalse();
                    assertThat(e.toDetails()).containsEntry("command", "sh -c echo broken >&2; exit 3");
                });
    }

    @Test
    @DisplayName("should return result on non-zero exit code when not raising")
    void shouldReturnFailureWhenNotRaising() throws CommandException {
        CommandResult result = runner.run(List.of("sh", "-c", "exit 2"), false, false);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReturnCode()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject output that is not JSON")
    void shouldRejectInvalidJson() {
        assertThatThrownBy(() -> runner.runJson(List.of("sh", "-c", "echo not-json")))
                .isInstanceOf(CommandException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    @DisplayName("should kill commands that exceed the timeout")
    void shouldTimeOut() {
        ProcessCommandRunner impatient = new ProcessCommandRunner(1, null);

        assertThatThrownBy(() -> impatient.run(List.of("sleep", "30")))
                .isInstanceOfSatisfying(CommandException.class, e -> assertThat(e.isTimeout()).isTrue());
    }

    @Test
    @DisplayName("should wrap failure to start the program")
    void shouldWrapStartFailure() {
        assertThatThrownBy(() -> runner.run(List.of("/nonexistent/pysolver-binary")))
                .isInstanceOf(CommandException.class)
                .hasMessageStartingWith("Failed to run command");
    }

    @Test
    @DisplayName("should reject non-positive timeout")
    void shouldRejectInvalidTimeout() {
        assertThatThrownBy(() -> new ProcessCommandRunner(0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
