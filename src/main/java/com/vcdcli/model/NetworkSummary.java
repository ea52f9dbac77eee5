package com.vcdcli.model;

/**
 * The projection of a network shown by the list commands.
 *
 * @param name The network name.
 */
public record NetworkSummary(String name) {
}
