package com.vcdcli.dto.response;

import com.vcdcli.exception.ErrorKind;
import com.vcdcli.model.NetworkSummary;
import com.vcdcli.model.TaskResult;

import java.util.List;

/**
 * A record that represents the outcome of one network command.
 * Exactly one of the shapes below is populated:
 * <ul>
 *   <li>a task, optionally followed by a confirmation message,</li>
 *   <li>a listing of networks,</li>
 *   <li>an abort after the user declined a confirmation,</li>
 *   <li>a failure with its {@link ErrorKind} and a single-line message.</li>
 * </ul>
 *
 * @param task     The task returned by the server, or {@code null}.
 * @param networks The networks returned by a list call, or {@code null}.
 * @param message  A confirmation message, the abort notice, or the failure message.
 * @param error    The failure classification, or {@code null} when the command succeeded.
 */
public record CommandOutcome(TaskResult task, List<NetworkSummary> networks, String message, ErrorKind error) {

    public static final String ABORTED = "Aborted.";

    public static CommandOutcome task(TaskResult task) {
        return new CommandOutcome(task, null, null, null);
    }

    public static CommandOutcome task(TaskResult task, String message) {
        return new CommandOutcome(task, null, message, null);
    }

    public static CommandOutcome listing(List<NetworkSummary> networks) {
        return new CommandOutcome(null, List.copyOf(networks), null, null);
    }

    public static CommandOutcome aborted() {
        return new CommandOutcome(null, null, ABORTED, null);
    }

    public static CommandOutcome failure(ErrorKind error, String message) {
        return new CommandOutcome(null, null, message, error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public boolean isAborted() {
        return succeeded() && task == null && networks == null && ABORTED.equals(message);
    }
}
