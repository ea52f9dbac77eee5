package com.vcdcli.dto.request;

/**
 * A record for creating an org VDC network bridged directly to an external network.
 *
 * @param name              The name of the new org VDC network.
 * @param parentNetworkName The name of the external network to connect to.
 * @param description       Free-text description; empty when not supplied.
 * @param shared            Whether the network is shared with the other VDCs of the organization.
 */
public record DirectNetworkSpec(String name, String parentNetworkName, String description, boolean shared) {
}
