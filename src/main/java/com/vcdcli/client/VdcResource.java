package com.vcdcli.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vcdcli.dto.request.DhcpSpec;
import com.vcdcli.dto.request.DirectNetworkSpec;
import com.vcdcli.dto.request.IsolatedNetworkSpec;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.exception.VcdCliException;
import com.vcdcli.model.NetworkSummary;
import com.vcdcli.model.TaskResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

import static com.vcdcli.client.PlatformResource.putIfPresent;

/**
 * A proxy for one org virtual datacenter and the org VDC networks it contains.
 */
@Slf4j
public class VdcResource {

    /** Query-service link type of a network bridged to an external network. */
    static final int LINK_TYPE_DIRECT = 0;
    static final int LINK_TYPE_ISOLATED = 2;

    private final VcdClient client;
    private final String href;

    public VdcResource(VcdClient client, String href) {
        this.client = client;
        this.href = href;
    }

    public String getHref() {
        return href;
    }

    /**
     * Creates an org VDC network bridged to an external network. The parent is looked up among
     * the networks available to the VDC's provider VDC, which requires system administrator rights.
     *
     * @param spec The network definition.
     * @return The first task queued by the server.
     */
    public TaskResult createDirectlyConnectedNetwork(DirectNetworkSpec spec) {
        String adminHref = adminHref();
        JsonNode providerVdcRef = client.get(adminHref).path("providerVdcReference");
        if (providerVdcRef.path("href").asText("").isEmpty()) {
            throw new VcdCliException(ErrorKind.REMOTE_REJECTED,
                    "The provider VDC of this VDC is not visible; only system administrators can create direct networks.");
        }
        JsonNode parent = VcdClient.findByName(
                        client.get(providerVdcRef.path("href").asText()).path("availableNetworks").path("network"),
                        spec.parentNetworkName())
                .orElseThrow(() -> new VcdCliException(ErrorKind.REMOTE_REJECTED,
                        "External network '" + spec.parentNetworkName() + "' not found."));

        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("name", spec.name());
        body.put("description", spec.description());
        ObjectNode configuration = body.putObject("configuration");
        ObjectNode parentNetwork = configuration.putObject("parentNetwork");
        parentNetwork.put("href", parent.path("href").asText());
        parentNetwork.put("name", spec.parentNetworkName());
        configuration.put("fenceMode", "bridged");
        body.put("isShared", spec.shared());

        log.debug("Creating direct network '{}' on parent '{}' in {}", spec.name(), spec.parentNetworkName(), href);
        return VcdClient.firstTask(client.post(adminHref + "/networks", VcdClient.ORG_VDC_NETWORK_TYPE, body));
    }

    /**
     * Creates an isolated org VDC network. When only the start of the static pool is given,
     * the pool holds that single address.
     *
     * @param spec The network definition.
     * @return The first task queued by the server.
     */
    public TaskResult createIsolatedNetwork(IsolatedNetworkSpec spec) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("name", spec.name());
        body.put("description", spec.description());

        ObjectNode configuration = body.putObject("configuration");
        ObjectNode ipScope = configuration.putObject("ipScopes").putArray("ipScope").addObject();
        ipScope.put("isInherited", false);
        ipScope.put("gateway", spec.gatewayIp());
        ipScope.put("netmask", spec.netmask());
        putIfPresent(ipScope, "dns1", spec.primaryDns());
        putIfPresent(ipScope, "dns2", spec.secondaryDns());
        putIfPresent(ipScope, "dnsSuffix", spec.dnsSuffix());
        if (spec.ipRangeStart() != null) {
            ObjectNode ipRange = ipScope.putObject("ipRanges").putArray("ipRange").addObject();
            ipRange.put("startAddress", spec.ipRangeStart());
            ipRange.put("endAddress", spec.ipRangeEnd() != null ? spec.ipRangeEnd() : spec.ipRangeStart());
        }
        configuration.put("fenceMode", "isolated");

        DhcpSpec dhcp = spec.dhcp();
        if (dhcp != null) {
            ObjectNode dhcpService = body.putObject("serviceConfig").putObject("dhcpService");
            dhcpService.put("isEnabled", dhcp.enabled());
            if (dhcp.defaultLeaseSeconds() != null) {
                dhcpService.put("defaultLeaseTime", dhcp.defaultLeaseSeconds());
            }
            if (dhcp.maxLeaseSeconds() != null) {
                dhcpService.put("maxLeaseTime", dhcp.maxLeaseSeconds());
            }
            if (dhcp.rangeStart() != null || dhcp.rangeEnd() != null) {
                ObjectNode range = dhcpService.putObject("ipRange");
                putIfPresent(range, "startAddress", dhcp.rangeStart());
                putIfPresent(range, "endAddress", dhcp.rangeEnd());
            }
        }
        body.put("isShared", spec.shared());

        log.debug("Creating isolated network '{}' in {}", spec.name(), href);
        return VcdClient.firstTask(client.post(adminHref() + "/networks", VcdClient.ORG_VDC_NETWORK_TYPE, body));
    }

    public List<NetworkSummary> listDirectNetworks() {
        return listNetworks(LINK_TYPE_DIRECT);
    }

    public List<NetworkSummary> listIsolatedNetworks() {
        return listNetworks(LINK_TYPE_ISOLATED);
    }

    public TaskResult deleteDirectNetwork(String name, boolean force) {
        return deleteNetwork(name, LINK_TYPE_DIRECT, "direct", force);
    }

    public TaskResult deleteIsolatedNetwork(String name, boolean force) {
        return deleteNetwork(name, LINK_TYPE_ISOLATED, "isolated", force);
    }

    private List<NetworkSummary> listNetworks(int linkType) {
        List<NetworkSummary> networks = new ArrayList<>();
        for (JsonNode record : queryNetworks(linkType)) {
            networks.add(new NetworkSummary(record.path("name").asText()));
        }
        return networks;
    }

    private TaskResult deleteNetwork(String name, int linkType, String kind, boolean force) {
        // names are matched here, a FIQL value cannot carry ';' or ','
        String networkHref = VcdClient.findByName(queryNetworks(linkType), name)
                .map(record -> record.path("href").asText())
                .orElseThrow(() -> new VcdCliException(ErrorKind.REMOTE_REJECTED,
                        "No " + kind + " org VDC network named '" + name + "' in the selected VDC."));
        return VcdClient.toTask(client.delete(force ? networkHref + "?force=true" : networkHref));
    }

    private JsonNode queryNetworks(int linkType) {
        return client.query("orgVdcNetwork", "vdc==" + href + ";linkType==" + linkType);
    }

    private String adminHref() {
        return href.replace("/api/vdc/", "/api/admin/vdc/");
    }
}
