package com.vcdcli.service.api;

import com.vcdcli.dto.request.DeleteNetworkRequest;
import com.vcdcli.dto.request.DirectNetworkSpec;
import com.vcdcli.dto.request.ExternalNetworkSpec;
import com.vcdcli.dto.request.ExternalNetworkUpdate;
import com.vcdcli.dto.request.IsolatedNetworkSpec;
import com.vcdcli.dto.response.CommandOutcome;

/**
 * The operations behind the {@code network} commands.
 * <p>
 * Each method restores the session, locates the remote resource, performs exactly one client
 * operation and reports the result as a {@link CommandOutcome}. Methods never throw: every
 * failure is returned as a failed outcome.
 */
public interface NetworkOperationInvoker {

    CommandOutcome createExternalNetwork(ExternalNetworkSpec spec);

    CommandOutcome listExternalNetworks();

    CommandOutcome deleteExternalNetwork(DeleteNetworkRequest request);

    CommandOutcome updateExternalNetwork(ExternalNetworkUpdate update);

    CommandOutcome createDirectNetwork(DirectNetworkSpec spec);

    CommandOutcome listDirectNetworks();

    CommandOutcome deleteDirectNetwork(DeleteNetworkRequest request);

    CommandOutcome createIsolatedNetwork(IsolatedNetworkSpec spec);

    CommandOutcome listIsolatedNetworks();

    CommandOutcome deleteIsolatedNetwork(DeleteNetworkRequest request);
}
