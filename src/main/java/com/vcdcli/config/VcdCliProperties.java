package com.vcdcli.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Settings for reaching vCloud Director, bound from the {@code vcd} prefix.
 * <p>
 * Values come from {@code application.properties} and can be overridden by environment
 * variables through Spring's relaxed binding (e.g. {@code VCD_API_VERSION}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "vcd")
public class VcdCliProperties {

    private static final String DATA_DIRECTORY = System.getenv("VCD_CLI_HOME") != null ? System.getenv("VCD_CLI_HOME") : System.getProperty("user.home");

    /** Location of the cached login profile; defaults to {@code ~/.vcd-cli/profile.json} */
    private String profileFile;

    /** API version used when the profile does not record one */
    private String apiVersion = "31.0";

    /** Page size for query-service listings; 128 is the server maximum */
    private int listPageSize = 128;

    /**
     * Resolves the profile location, falling back to the default under {@code VCD_CLI_HOME}
     * or the user's home directory.
     * @return The path of the profile file
     */
    public Path resolveProfilePath() {
        if (profileFile != null && !profileFile.isBlank()) {
            return Path.of(profileFile);
        }
        return Path.of(DATA_DIRECTORY, ".vcd-cli", "profile.json");
    }
}
