package com.vcdcli.cli;

import com.vcdcli.dto.response.CommandOutcome;
import com.vcdcli.exception.CommandFailedException;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.model.NetworkSummary;
import com.vcdcli.model.TaskResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vcdcli.cli.OutcomeRenderer.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutcomeRendererTest {

    private final OutcomeRenderer renderer = new OutcomeRenderer();

    @Test
    void render_task_shouldPrintOperationStatusHrefAndMessage() {
        TaskResult task = new TaskResult("https://vcd/api/task/7", "urn:vcloud:task:7",
                "networkDelete", "Deleting Network ext-net1", "running");

        String output = renderer.render(CommandOutcome.task(task, "External network deleted successfully."));

        assertThat(output).isEqualTo("operation  Deleting Network ext-net1\n"
                + "status     running\n"
                + "href       https://vcd/api/task/7\n"
                + ANSI_GREEN + "External network deleted successfully." + ANSI_RESET);
    }

    @Test
    void render_taskWithoutOperationText_shouldFallBackToOperationName() {
        TaskResult task = new TaskResult("https://vcd/api/task/8", null, "networkCreateOrgVdcNetwork", null, "queued");

        assertThat(renderer.render(CommandOutcome.task(task))).startsWith("operation  networkCreateOrgVdcNetwork\n");
    }

    @Test
    void render_listing_shouldPrintHeaderThenNamesInOrder() {
        String output = renderer.render(CommandOutcome.listing(List.of(new NetworkSummary("b"), new NetworkSummary("a"))));

        assertThat(output).isEqualTo(ANSI_YELLOW + "name" + ANSI_RESET + "\nb\na");
    }

    @Test
    void render_emptyListing_shouldPrintOnlyHeader() {
        assertThat(renderer.render(CommandOutcome.listing(List.of()))).isEqualTo(ANSI_YELLOW + "name" + ANSI_RESET);
    }

    @Test
    void render_aborted_shouldPrintAborted() {
        assertThat(renderer.render(CommandOutcome.aborted())).isEqualTo("Aborted.");
    }

    @Test
    void render_failure_shouldRaiseCommandFailedException() {
        assertThatThrownBy(() -> renderer.render(CommandOutcome.failure(ErrorKind.AUTH_FAILURE, "Session not found or expired. Please log in.")))
                .isInstanceOf(CommandFailedException.class)
                .hasMessage("Session not found or expired. Please log in.")
                .satisfies(e -> assertThat(((CommandFailedException) e).getKind()).isEqualTo(ErrorKind.AUTH_FAILURE));
    }

    @Test
    void renderError_shouldFlattenMultiLineMessages() {
        assertThat(renderer.renderError("Network is in use:\n  vApp web-01\n  vApp db-01"))
                .isEqualTo(ANSI_RED + "Network is in use: vApp web-01 vApp db-01" + ANSI_RESET);
    }
}
