package com.vcdcli.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcdcli.client.VcdClientFactory;
import com.vcdcli.config.VcdCliProperties;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.exception.VcdCliException;
import com.vcdcli.model.Profile;
import com.vcdcli.model.SessionContext;
import com.vcdcli.service.api.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A {@link SessionService} that restores the session from the JSON profile left behind by the
 * login tool.
 * <p>
 * The profile is read afresh on every call so that an interactive shell picks up a new login
 * or VDC selection, and it is never written.
 */
@Service
@Slf4j
public class ProfileSessionService implements SessionService {

    private final VcdCliProperties properties;
    private final VcdClientFactory clientFactory;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ProfileSessionService(VcdCliProperties properties, VcdClientFactory clientFactory) {
        this.properties = properties;
        this.clientFactory = clientFactory;
    }

    /**
     * {@inheritDoc}
     * <p>
     * A missing, empty or unparsable profile, or one without host or token, is reported as
     * {@code AUTH_FAILURE}. The token itself is only checked by the server on the first request.
     */
    @Override
    public SessionContext restoreSession(boolean requireVdcSelected) {
        Profile profile = loadProfile(properties.resolveProfilePath());
        if (isBlank(profile.getHost()) || isBlank(profile.getToken())) {
            throw new VcdCliException(ErrorKind.AUTH_FAILURE, "Session not found or expired. Please log in.");
        }
        if (requireVdcSelected && isBlank(profile.getVdcHref())) {
            throw new VcdCliException(ErrorKind.NO_VDC_SELECTED,
                    "No virtual datacenter selected. Select one with 'vdc use' first.");
        }
        log.debug("Restored session for org '{}' on {} (vdc: {})", profile.getOrg(), profile.getHost(), profile.getVdc());
        return new SessionContext(clientFactory.create(profile), profile.getOrg(), profile.getVdc(), profile.getVdcHref());
    }

    private Profile loadProfile(Path path) {
        if (!Files.isRegularFile(path)) {
            log.debug("No profile found at {}", path);
            throw new VcdCliException(ErrorKind.AUTH_FAILURE, "Session not found or expired. Please log in.");
        }
        try {
            if (Files.size(path) == 0) {
                throw new VcdCliException(ErrorKind.AUTH_FAILURE, "Session not found or expired. Please log in.");
            }
            return objectMapper.readValue(path.toFile(), Profile.class);
        } catch (IOException e) {
            log.warn("Could not read profile at {}: {}", path, e.getMessage());
            throw new VcdCliException(ErrorKind.AUTH_FAILURE, "The cached session at " + path + " is unreadable. Please log in again.", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
