package com.vcdcli.model;

import com.vcdcli.client.VcdClient;

/**
 * The state a single command runs against: an authenticated client plus the organization and
 * virtual datacenter selected at login. Built once per invocation and never modified.
 *
 * @param client          The authenticated REST client.
 * @param org             The organization the session belongs to.
 * @param selectedVdcName The name of the selected VDC, or {@code null}.
 * @param selectedVdcHref The href of the selected VDC, or {@code null}.
 */
public record SessionContext(VcdClient client, String org, String selectedVdcName, String selectedVdcHref) {

    public boolean hasSelectedVdc() {
        return selectedVdcHref != null && !selectedVdcHref.isBlank();
    }
}
