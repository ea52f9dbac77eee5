package com.vcdcli.service.api;

import com.vcdcli.client.PlatformResource;
import com.vcdcli.client.VdcResource;
import com.vcdcli.model.SessionContext;

/**
 * Resolves the session into proxies for remote resources. Lookups use only state already
 * held by the session and never contact the server.
 */
public interface ResourceLocator {

    /**
     * @param session The restored session.
     * @return The system-level resource derived from the authenticated client.
     */
    PlatformResource platform(SessionContext session);

    /**
     * @param session The restored session.
     * @return The selected virtual datacenter.
     * @throws com.vcdcli.exception.VcdCliException with {@code NO_VDC_SELECTED} when the session has none.
     */
    VdcResource vdc(SessionContext session);
}
