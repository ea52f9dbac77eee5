package com.vcdcli.dto.request;

/**
 * A record describing a partial update of an external network's name and description.
 * Fields left {@code null} keep their current value on the server.
 *
 * @param name           The current name of the external network.
 * @param newName        The new name, or {@code null} to keep the current one.
 * @param newDescription The new description, or {@code null} to keep the current one.
 */
public record ExternalNetworkUpdate(String name, String newName, String newDescription) {

    /**
     * @return The name the network will carry after the update.
     */
    public String effectiveName() {
        return newName != null ? newName : name;
    }
}
