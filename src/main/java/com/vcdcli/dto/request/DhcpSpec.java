package com.vcdcli.dto.request;

/**
 * A record describing the DHCP pool embedded in an isolated network.
 *
 * @param enabled             Whether the DHCP service is switched on.
 * @param defaultLeaseSeconds Default lease, or {@code null} to let the server decide.
 * @param maxLeaseSeconds     Maximum lease, or {@code null} to let the server decide.
 * @param rangeStart          First address handed out, or {@code null}.
 * @param rangeEnd            Last address handed out, or {@code null}.
 */
public record DhcpSpec(boolean enabled,
                       Integer defaultLeaseSeconds,
                       Integer maxLeaseSeconds,
                       String rangeStart,
                       String rangeEnd) {
}
