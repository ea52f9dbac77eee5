package com.vcdcli.service.impl;

import com.vcdcli.client.PlatformResource;
import com.vcdcli.client.VdcResource;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.exception.VcdCliException;
import com.vcdcli.model.SessionContext;
import com.vcdcli.service.api.ResourceLocator;
import org.springframework.stereotype.Component;

@Component
public class SessionResourceLocator implements ResourceLocator {

    @Override
    public PlatformResource platform(SessionContext session) {
        return new PlatformResource(session.client());
    }

    @Override
    public VdcResource vdc(SessionContext session) {
        if (!session.hasSelectedVdc()) {
            throw new VcdCliException(ErrorKind.NO_VDC_SELECTED,
                    "No virtual datacenter selected. Select one with 'vdc use' first.");
        }
        return new VdcResource(session.client(), session.selectedVdcHref());
    }
}
