package com.vcdcli.dto.request;

/**
 * A record for creating an isolated org VDC network, optionally with a DHCP pool.
 * Address values are passed to the server as given; the server validates them.
 *
 * @param name         The name of the new network.
 * @param gatewayIp    The gateway address.
 * @param netmask      The network mask.
 * @param description  Free-text description; empty when not supplied.
 * @param primaryDns   Primary DNS server, or {@code null}.
 * @param secondaryDns Secondary DNS server, or {@code null}.
 * @param dnsSuffix    DNS suffix, or {@code null}.
 * @param ipRangeStart Start of the static allocation pool, or {@code null}.
 * @param ipRangeEnd   End of the static allocation pool, or {@code null}.
 * @param dhcp         The DHCP pool, or {@code null} when DHCP is not enabled.
 * @param shared       Whether the network is shared with the other VDCs of the organization.
 */
public record IsolatedNetworkSpec(String name,
                                  String gatewayIp,
                                  String netmask,
                                  String description,
                                  String primaryDns,
                                  String secondaryDns,
                                  String dnsSuffix,
                                  String ipRangeStart,
                                  String ipRangeEnd,
                                  DhcpSpec dhcp,
                                  boolean shared) {
}
