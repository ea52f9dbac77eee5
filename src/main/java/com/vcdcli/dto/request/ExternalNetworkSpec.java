package com.vcdcli.dto.request;

import java.util.List;

/**
 * A record that carries everything needed to create an external network backed by
 * vCenter port groups.
 *
 * @param name          The name of the new external network.
 * @param vimServerName The name of the registered vCenter server that owns the port groups.
 * @param portGroups    The port group names, in the order given on the command line.
 * @param gatewayIp     The gateway address of the subnet.
 * @param netmask       The network mask of the subnet.
 * @param ipRanges      Static IP ranges in {@code start-end} form, in the order given.
 * @param description   Free-text description; empty when not supplied.
 * @param primaryDns    Primary DNS server, or {@code null}.
 * @param secondaryDns  Secondary DNS server, or {@code null}.
 * @param dnsSuffix     DNS suffix, or {@code null}.
 */
public record ExternalNetworkSpec(String name,
                                  String vimServerName,
                                  List<String> portGroups,
                                  String gatewayIp,
                                  String netmask,
                                  List<String> ipRanges,
                                  String description,
                                  String primaryDns,
                                  String secondaryDns,
                                  String dnsSuffix) {

    public ExternalNetworkSpec {
        portGroups = portGroups == null ? List.of() : List.copyOf(portGroups);
        ipRanges = ipRanges == null ? List.of() : List.copyOf(ipRanges);
    }
}
