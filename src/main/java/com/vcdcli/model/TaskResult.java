package com.vcdcli.model;

/**
 * An opaque handle to an asynchronous vCloud task, as returned by create, update and delete
 * calls. The CLI reports it and never waits for it to finish.
 *
 * @param href          The task URL.
 * @param id            The task URN.
 * @param operationName The machine name of the operation, e.g. {@code networkCreateExternalNetwork}.
 * @param operation     The human-readable operation description.
 * @param status        The status at the time of the response, usually {@code queued} or {@code running}.
 */
public record TaskResult(String href, String id, String operationName, String operation, String status) {
}
