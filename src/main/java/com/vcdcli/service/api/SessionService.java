package com.vcdcli.service.api;

import com.vcdcli.model.SessionContext;

/**
 * An interface for re-establishing the session cached by a previous login.
 * Implementations only read the cache; logging in and selecting a VDC happen elsewhere.
 */
public interface SessionService {

    /**
     * Restores the cached session.
     *
     * @param requireVdcSelected Whether the calling command operates inside a VDC.
     * @return The session for this invocation.
     * @throws com.vcdcli.exception.VcdCliException with {@code AUTH_FAILURE} when there is no
     *         usable session, or {@code NO_VDC_SELECTED} when a VDC is required but none is selected.
     */
    SessionContext restoreSession(boolean requireVdcSelected);
}
