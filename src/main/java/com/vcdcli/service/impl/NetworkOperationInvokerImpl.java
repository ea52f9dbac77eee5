package com.vcdcli.service.impl;

import com.vcdcli.dto.request.DeleteNetworkRequest;
import com.vcdcli.dto.request.DirectNetworkSpec;
import com.vcdcli.dto.request.ExternalNetworkSpec;
import com.vcdcli.dto.request.ExternalNetworkUpdate;
import com.vcdcli.dto.request.IsolatedNetworkSpec;
import com.vcdcli.dto.response.CommandOutcome;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.exception.VcdCliException;
import com.vcdcli.model.SessionContext;
import com.vcdcli.service.api.ConfirmationPrompt;
import com.vcdcli.service.api.NetworkOperationInvoker;
import com.vcdcli.service.api.ResourceLocator;
import com.vcdcli.service.api.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Function;

/**
 * The default {@link NetworkOperationInvoker}.
 * <p>
 * Argument checks are limited to the presence of required repeatable arguments; addresses,
 * masks and DHCP ranges are passed through and validated by the server. Delete operations ask
 * for confirmation before the session is even restored, so a declined prompt causes no traffic.
 */
@Service
@Slf4j
public class NetworkOperationInvokerImpl implements NetworkOperationInvoker {

    static final String EXTERNAL_DELETE_PROMPT = "Are you sure you want to delete the external network?";
    static final String ORG_VDC_DELETE_PROMPT = "Are you sure you want to delete the OrgVdc Network?";

    private final SessionService sessionService;
    private final ResourceLocator resourceLocator;
    private final ConfirmationPrompt confirmationPrompt;

    public NetworkOperationInvokerImpl(SessionService sessionService,
                                       ResourceLocator resourceLocator,
                                       ConfirmationPrompt confirmationPrompt) {
        this.sessionService = sessionService;
        this.resourceLocator = resourceLocator;
        this.confirmationPrompt = confirmationPrompt;
    }

    @Override
    public CommandOutcome createExternalNetwork(ExternalNetworkSpec spec) {
        if (spec.portGroups().isEmpty()) {
            return CommandOutcome.failure(ErrorKind.VALIDATION, "Missing option '--port-group': at least one port group is required.");
        }
        if (spec.ipRanges().isEmpty()) {
            return CommandOutcome.failure(ErrorKind.VALIDATION, "Missing option '--ip-range': at least one IP range is required.");
        }
        return invoke("create external network '" + spec.name() + "'", false, session ->
                CommandOutcome.task(resourceLocator.platform(session).createExternalNetwork(spec),
                        "External network created successfully."));
    }

    @Override
    public CommandOutcome listExternalNetworks() {
        return invoke("list external networks", false, session ->
                CommandOutcome.listing(resourceLocator.platform(session).listExternalNetworks()));
    }

    @Override
    public CommandOutcome deleteExternalNetwork(DeleteNetworkRequest request) {
        if (!confirmed(request, EXTERNAL_DELETE_PROMPT)) {
            return CommandOutcome.aborted();
        }
        return invoke("delete external network '" + request.name() + "'", false, session ->
                CommandOutcome.task(resourceLocator.platform(session).deleteExternalNetwork(request.name()),
                        "External network deleted successfully."));
    }

    @Override
    public CommandOutcome updateExternalNetwork(ExternalNetworkUpdate update) {
        return invoke("update external network '" + update.name() + "'", false, session ->
                CommandOutcome.task(resourceLocator.platform(session).updateExternalNetwork(update),
                        "External network updated successfully."));
    }

    @Override
    public CommandOutcome createDirectNetwork(DirectNetworkSpec spec) {
        return invoke("create direct network '" + spec.name() + "'", true, session ->
                CommandOutcome.task(resourceLocator.vdc(session).createDirectlyConnectedNetwork(spec)));
    }

    @Override
    public CommandOutcome listDirectNetworks() {
        return invoke("list direct networks", true, session ->
                CommandOutcome.listing(resourceLocator.vdc(session).listDirectNetworks()));
    }

    @Override
    public CommandOutcome deleteDirectNetwork(DeleteNetworkRequest request) {
        if (!confirmed(request, ORG_VDC_DELETE_PROMPT)) {
            return CommandOutcome.aborted();
        }
        return invoke("delete direct network '" + request.name() + "'", true, session ->
                CommandOutcome.task(resourceLocator.vdc(session).deleteDirectNetwork(request.name(), request.force())));
    }

    @Override
    public CommandOutcome createIsolatedNetwork(IsolatedNetworkSpec spec) {
        return invoke("create isolated network '" + spec.name() + "'", true, session ->
                CommandOutcome.task(resourceLocator.vdc(session).createIsolatedNetwork(spec)));
    }

    @Override
    public CommandOutcome listIsolatedNetworks() {
        return invoke("list isolated networks", true, session ->
                CommandOutcome.listing(resourceLocator.vdc(session).listIsolatedNetworks()));
    }

    @Override
    public CommandOutcome deleteIsolatedNetwork(DeleteNetworkRequest request) {
        if (!confirmed(request, ORG_VDC_DELETE_PROMPT)) {
            return CommandOutcome.aborted();
        }
        return invoke("delete isolated network '" + request.name() + "'", true, session ->
                CommandOutcome.task(resourceLocator.vdc(session).deleteIsolatedNetwork(request.name(), request.force())));
    }

    private boolean confirmed(DeleteNetworkRequest request, String prompt) {
        return request.assumeYes() || confirmationPrompt.confirm(prompt);
    }

    /**
     * Restores the session and runs a single remote operation, turning any failure into a
     * failed outcome.
     */
    private CommandOutcome invoke(String description, boolean requireVdc, Function<SessionContext, CommandOutcome> operation) {
        log.info("Attempting to {}", description);
        try {
            SessionContext session = sessionService.restoreSession(requireVdc);
            return operation.apply(session);
        } catch (VcdCliException e) {
            log.debug("Could not {}: {}", description, e.getMessage(), e);
            return CommandOutcome.failure(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while trying to {}", description, e);
            return CommandOutcome.failure(ErrorKind.INTERNAL, "Unexpected error: " + e.getMessage());
        }
    }
}
