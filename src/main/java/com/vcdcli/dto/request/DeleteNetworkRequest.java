package com.vcdcli.dto.request;

/**
 * A record for the delete commands.
 *
 * @param name      The name of the network to delete.
 * @param force     Asks the server to delete the network even while it is in use.
 * @param assumeYes Skips the interactive confirmation.
 */
public record DeleteNetworkRequest(String name, boolean force, boolean assumeYes) {
}
