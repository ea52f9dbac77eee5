package com.vcdcli.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.ToString;

/**
 * The cached login profile written by the login tool and read at the start of every command.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Profile {

    /**
     * Hostname of the vCloud Director endpoint.
     */
    private String host;

    private int port = 443;

    /**
     * The API version negotiated at login, e.g. {@code 31.0}. Falls back to the configured default.
     */
    private String apiVersion;

    /**
     * The session token, sent as {@code x-vcloud-authorization}.
     */
    @ToString.Exclude
    private String token;

    private String org;

    /**
     * Name of the VDC selected with {@code vdc use}, if any.
     */
    private String vdc;

    private String vdcHref;

    private boolean verifySsl = true;
}
