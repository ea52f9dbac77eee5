package com.vcdcli.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vcdcli.dto.request.ExternalNetworkSpec;
import com.vcdcli.dto.request.ExternalNetworkUpdate;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.exception.VcdCliException;
import com.vcdcli.model.NetworkSummary;
import com.vcdcli.model.TaskResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * A proxy for the system-level vCloud resources that only system administrators can manage,
 * here the external networks.
 */
@Slf4j
public class PlatformResource {

    static final String EXTERNAL_NETWORK_REFERENCES = "/api/admin/extension/externalNetworkReferences";
    static final String VIM_SERVER_REFERENCES = "/api/admin/extension/vimServerReferences";
    static final String EXTERNAL_NETWORKS = "/api/admin/extension/externalnets";

    private final VcdClient client;

    public PlatformResource(VcdClient client) {
        this.client = client;
    }

    /**
     * Creates an external network backed by port groups of a registered vCenter server.
     * The vCenter and port group names are resolved to references before the create request.
     *
     * @param spec The network definition.
     * @return The first task queued by the server.
     */
    public TaskResult createExternalNetwork(ExternalNetworkSpec spec) {
        JsonNode vimServer = VcdClient.findByName(client.get(VIM_SERVER_REFERENCES).path("vimServerReference"), spec.vimServerName())
                .orElseThrow(() -> new VcdCliException(ErrorKind.REMOTE_REJECTED,
                        "vCenter server '" + spec.vimServerName() + "' not found."));
        JsonNode portGroupRecords = client.query("portgroup", "vc==" + vimServer.path("href").asText());

        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("name", spec.name());
        body.put("description", spec.description());

        ObjectNode configuration = body.putObject("configuration");
        configuration.put("fenceMode", "isolated");
        ObjectNode ipScope = configuration.putObject("ipScopes").putArray("ipScope").addObject();
        ipScope.put("isInherited", false);
        ipScope.put("gateway", spec.gatewayIp());
        ipScope.put("netmask", spec.netmask());
        putIfPresent(ipScope, "dns1", spec.primaryDns());
        putIfPresent(ipScope, "dns2", spec.secondaryDns());
        putIfPresent(ipScope, "dnsSuffix", spec.dnsSuffix());
        ArrayNode ipRanges = ipScope.putObject("ipRanges").putArray("ipRange");
        for (String range : spec.ipRanges()) {
            int dash = range.indexOf('-');
            ObjectNode ipRange = ipRanges.addObject();
            ipRange.put("startAddress", dash < 0 ? range : range.substring(0, dash));
            ipRange.put("endAddress", dash < 0 ? range : range.substring(dash + 1));
        }

        ArrayNode portGroupRefs = body.putObject("vimPortGroupRefs").putArray("vimObjectRef");
        for (String portGroup : spec.portGroups()) {
            JsonNode record = VcdClient.findByName(portGroupRecords, portGroup)
                    .orElseThrow(() -> new VcdCliException(ErrorKind.REMOTE_REJECTED,
                            "Port group '" + portGroup + "' not found on vCenter server '" + spec.vimServerName() + "'."));
            ObjectNode ref = portGroupRefs.addObject();
            ref.putObject("vimServerRef").put("href", vimServer.path("href").asText());
            ref.put("moRef", record.path("moref").asText());
            ref.put("vimObjectType", record.path("portgroupType").asText());
        }

        log.debug("Creating external network '{}' on vCenter '{}'", spec.name(), spec.vimServerName());
        return VcdClient.firstTask(client.post(EXTERNAL_NETWORKS, VcdClient.EXTERNAL_NETWORK_TYPE, body));
    }

    /**
     * @return The external networks in the order reported by the server.
     */
    public List<NetworkSummary> listExternalNetworks() {
        List<NetworkSummary> networks = new ArrayList<>();
        for (JsonNode reference : client.get(EXTERNAL_NETWORK_REFERENCES).path("externalNetworkReference")) {
            networks.add(new NetworkSummary(reference.path("name").asText()));
        }
        return networks;
    }

    public TaskResult deleteExternalNetwork(String name) {
        return VcdClient.toTask(client.delete(externalNetworkHref(name)));
    }

    /**
     * Updates the name and/or description of an external network. The current representation
     * is fetched first so that fields not named in the update are sent back unchanged.
     *
     * @param update The partial update.
     * @return The first task queued by the server.
     */
    public TaskResult updateExternalNetwork(ExternalNetworkUpdate update) {
        String href = externalNetworkHref(update.name());
        ObjectNode network = client.get(href).deepCopy();
        network.remove("tasks");
        network.put("name", update.effectiveName());
        if (update.newDescription() != null) {
            network.put("description", update.newDescription());
        }
        return VcdClient.firstTask(client.put(href, VcdClient.EXTERNAL_NETWORK_TYPE, network));
    }

    private String externalNetworkHref(String name) {
        return VcdClient.findByName(client.get(EXTERNAL_NETWORK_REFERENCES).path("externalNetworkReference"), name)
                .map(reference -> reference.path("href").asText())
                .orElseThrow(() -> new VcdCliException(ErrorKind.REMOTE_REJECTED, "External network '" + name + "' not found."));
    }

    static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
