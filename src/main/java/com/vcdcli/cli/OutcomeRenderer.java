package com.vcdcli.cli;

import com.vcdcli.dto.response.CommandOutcome;
import com.vcdcli.exception.CommandFailedException;
import com.vcdcli.model.NetworkSummary;
import com.vcdcli.model.TaskResult;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link CommandOutcome} into the text printed by the shell.
 * Failed outcomes are raised as {@link CommandFailedException} for {@link CommandFailureResolver}.
 */
@Component
public class OutcomeRenderer {

    // ANSI escape codes for coloring the output
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";

    /**
     * @param outcome The outcome of a network operation.
     * @return The text to print for a successful or aborted operation.
     * @throws CommandFailedException if the outcome is a failure.
     */
    public String render(CommandOutcome outcome) {
        if (!outcome.succeeded()) {
            throw new CommandFailedException(outcome.error(), outcome.message());
        }
        if (outcome.isAborted()) {
            return outcome.message();
        }

        StringBuilder sb = new StringBuilder();
        if (outcome.task() != null) {
            appendTask(sb, outcome.task());
        }
        if (outcome.networks() != null) {
            sb.append(ANSI_YELLOW).append("name").append(ANSI_RESET);
            for (NetworkSummary network : outcome.networks()) {
                sb.append('\n').append(network.name());
            }
        }
        if (outcome.message() != null) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append(ANSI_GREEN).append(outcome.message()).append(ANSI_RESET);
        }
        return sb.toString();
    }

    /**
     * Formats a failure as a single red line; line breaks in server messages are flattened.
     */
    public String renderError(String message) {
        String line = message == null ? "Command failed." : message.replaceAll("\\s*\\R\\s*", " ").trim();
        return ANSI_RED + line + ANSI_RESET;
    }

    private void appendTask(StringBuilder sb, TaskResult task) {
        sb.append("operation  ").append(task.operation() != null ? task.operation() : task.operationName()).append('\n');
        sb.append("status     ").append(task.status()).append('\n');
        sb.append("href       ").append(task.href());
    }
}
