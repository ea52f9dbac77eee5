package com.vcdcli.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcdcli.dto.request.DhcpSpec;
import com.vcdcli.dto.request.DirectNetworkSpec;
import com.vcdcli.dto.request.IsolatedNetworkSpec;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.exception.VcdCliException;
import com.vcdcli.model.NetworkSummary;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VdcResourceTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer mockWebServer;
    private String baseUrl;
    private VdcResource vdc;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        baseUrl = String.format("http://localhost:%s", mockWebServer.getPort());
        vdc = new VdcResource(new VcdClient(WebClient.builder().baseUrl(baseUrl).build(), 128), baseUrl + "/api/vdc/v1");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private void enqueueJson(String body) {
        mockWebServer.enqueue(new MockResponse()
                .setBody(body)
                .addHeader("Content-Type", "application/json"));
    }

    private void enqueueCreatedNetwork() {
        enqueueJson("{\"name\":\"net\",\"tasks\":{\"task\":[{\"href\":\"" + baseUrl + "/api/task/9\","
                + "\"id\":\"urn:vcloud:task:9\",\"operationName\":\"networkCreateOrgVdcNetwork\",\"status\":\"queued\"}]}}");
    }

    private static String decodedPath(RecordedRequest request) {
        return URLDecoder.decode(request.getPath(), StandardCharsets.UTF_8);
    }

    @Test
    void createIsolatedNetwork_shouldSendDhcpServiceAndStaticPool() throws Exception {
        // --- Arrange ---
        enqueueCreatedNetwork();
        IsolatedNetworkSpec spec = new IsolatedNetworkSpec("iso-net1", "192.168.1.1", "255.255.255.0",
                "Isolated VDC network", "8.8.8.8", "8.8.4.4", "example.com", "192.168.1.100", "192.168.1.199",
                new DhcpSpec(true, 3600, 7200, "192.168.1.200", "192.168.1.250"), true);

        // --- Act ---
        assertThat(vdc.createIsolatedNetwork(spec).status()).isEqualTo("queued");

        // --- Assert ---
        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/admin/vdc/v1/networks");
        assertThat(request.getHeader("Content-Type")).startsWith(VcdClient.ORG_VDC_NETWORK_TYPE);

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("configuration").path("fenceMode").asText()).isEqualTo("isolated");
        assertThat(body.path("isShared").asBoolean()).isTrue();
        JsonNode ipScope = body.path("configuration").path("ipScopes").path("ipScope").path(0);
        assertThat(ipScope.path("gateway").asText()).isEqualTo("192.168.1.1");
        assertThat(ipScope.path("dns2").asText()).isEqualTo("8.8.4.4");
        JsonNode pool = ipScope.path("ipRanges").path("ipRange").path(0);
        assertThat(pool.path("startAddress").asText()).isEqualTo("192.168.1.100");
        assertThat(pool.path("endAddress").asText()).isEqualTo("192.168.1.199");

        JsonNode dhcp = body.path("serviceConfig").path("dhcpService");
        assertThat(dhcp.path("isEnabled").asBoolean()).isTrue();
        assertThat(dhcp.path("defaultLeaseTime").asInt()).isEqualTo(3600);
        assertThat(dhcp.path("maxLeaseTime").asInt()).isEqualTo(7200);
        assertThat(dhcp.path("ipRange").path("startAddress").asText()).isEqualTo("192.168.1.200");
        assertThat(dhcp.path("ipRange").path("endAddress").asText()).isEqualTo("192.168.1.250");
    }

    @Test
    void createIsolatedNetwork_withOnlyPoolStart_shouldUseStartAsEnd() throws Exception {
        enqueueCreatedNetwork();
        IsolatedNetworkSpec spec = new IsolatedNetworkSpec("iso-net1", "192.168.1.1", "255.255.255.0",
                "", null, null, null, "192.168.1.100", null, null, false);

        vdc.createIsolatedNetwork(spec);

        JsonNode body = objectMapper.readTree(mockWebServer.takeRequest().getBody().readUtf8());
        JsonNode pool = body.path("configuration").path("ipScopes").path("ipScope").path(0).path("ipRanges").path("ipRange").path(0);
        assertThat(pool.path("endAddress").asText()).isEqualTo("192.168.1.100");
        assertThat(body.has("serviceConfig")).isFalse();
        assertThat(body.path("isShared").asBoolean()).isFalse();
    }

    @Test
    void createDirectlyConnectedNetwork_shouldBridgeToParentFromProviderVdc() throws Exception {
        // --- Arrange ---
        enqueueJson("{\"name\":\"vdc1\",\"providerVdcReference\":{\"href\":\"" + baseUrl + "/api/admin/providervdc/p1\"}}");
        enqueueJson("{\"availableNetworks\":{\"network\":["
                + "{\"name\":\"other\",\"href\":\"" + baseUrl + "/api/admin/network/o\"},"
                + "{\"name\":\"ext-net1\",\"href\":\"" + baseUrl + "/api/admin/network/e1\"}]}}");
        enqueueCreatedNetwork();

        // --- Act ---
        vdc.createDirectlyConnectedNetwork(new DirectNetworkSpec("direct-net1", "ext-net1", "Directly connected VDC network", true));

        // --- Assert ---
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/api/admin/vdc/v1");
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/api/admin/providervdc/p1");
        RecordedRequest create = mockWebServer.takeRequest();
        assertThat(create.getPath()).isEqualTo("/api/admin/vdc/v1/networks");
        JsonNode body = objectMapper.readTree(create.getBody().readUtf8());
        assertThat(body.path("name").asText()).isEqualTo("direct-net1");
        assertThat(body.path("description").asText()).isEqualTo("Directly connected VDC network");
        assertThat(body.path("configuration").path("fenceMode").asText()).isEqualTo("bridged");
        assertThat(body.path("configuration").path("parentNetwork").path("href").asText()).endsWith("/api/admin/network/e1");
        assertThat(body.path("isShared").asBoolean()).isTrue();
    }

    @Test
    void createDirectlyConnectedNetwork_withUnknownParent_shouldNotPost() {
        enqueueJson("{\"providerVdcReference\":{\"href\":\"" + baseUrl + "/api/admin/providervdc/p1\"}}");
        enqueueJson("{\"availableNetworks\":{\"network\":[]}}");

        assertThatThrownBy(() -> vdc.createDirectlyConnectedNetwork(new DirectNetworkSpec("d", "ext-missing", "", false)))
                .isInstanceOf(VcdCliException.class)
                .hasMessageContaining("ext-missing");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    void listDirectNetworks_shouldQueryByVdcAndLinkTypeAndKeepOrder() throws Exception {
        enqueueJson("{\"record\":[{\"name\":\"net-b\"},{\"name\":\"net-a\"}]}");

        assertThat(vdc.listDirectNetworks()).extracting(NetworkSummary::name).containsExactly("net-b", "net-a");

        String path = decodedPath(mockWebServer.takeRequest());
        assertThat(path).startsWith("/api/query?type=orgVdcNetwork")
                .contains("pageSize=128")
                .contains("filter=vdc==" + baseUrl + "/api/vdc/v1;linkType==0");
    }

    @Test
    void listIsolatedNetworks_withNoRecords_shouldReturnEmptyList() throws Exception {
        enqueueJson("{\"total\":0}");

        assertThat(vdc.listIsolatedNetworks()).isEmpty();
        assertThat(decodedPath(mockWebServer.takeRequest())).contains("linkType==2");
    }

    @Test
    void deleteIsolatedNetwork_withForce_shouldForwardForceFlag() throws Exception {
        enqueueJson("{\"record\":[{\"name\":\"iso-net1\",\"href\":\"" + baseUrl + "/api/admin/network/n1\"}]}");
        enqueueJson("{\"href\":\"" + baseUrl + "/api/task/3\",\"operationName\":\"networkDelete\",\"status\":\"queued\"}");

        vdc.deleteIsolatedNetwork("iso-net1", true);

        assertThat(decodedPath(mockWebServer.takeRequest()))
                .contains("filter=vdc==" + baseUrl + "/api/vdc/v1;linkType==2")
                .doesNotContain("name==");
        RecordedRequest delete = mockWebServer.takeRequest();
        assertThat(delete.getMethod()).isEqualTo("DELETE");
        assertThat(delete.getPath()).isEqualTo("/api/admin/network/n1?force=true");
    }

    @Test
    void deleteDirectNetwork_withoutForce_shouldSendPlainDelete() throws Exception {
        enqueueJson("{\"record\":[{\"name\":\"direct-net1\",\"href\":\"" + baseUrl + "/api/admin/network/d1\"}]}");
        enqueueJson("{\"href\":\"" + baseUrl + "/api/task/4\",\"status\":\"queued\"}");

        vdc.deleteDirectNetwork("direct-net1", false);

        mockWebServer.takeRequest();
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/api/admin/network/d1");
    }

    @Test
    void deleteDirectNetwork_whenMissing_shouldBeRejectedWithoutDelete() {
        enqueueJson("{\"record\":[]}");

        assertThatThrownBy(() -> vdc.deleteDirectNetwork("ghost", false))
                .isInstanceOf(VcdCliException.class)
                .hasMessage("No direct org VDC network named 'ghost' in the selected VDC.")
                .satisfies(e -> assertThat(((VcdCliException) e).getKind()).isEqualTo(ErrorKind.REMOTE_REJECTED));
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    void listDirectNetworks_shouldFollowNextPageLinks() throws Exception {
        // --- Arrange ---
        String secondPage = baseUrl + "/api/query?type=orgVdcNetwork&page=2&pageSize=2&format=records"
                + "&filter=vdc%3D%3D" + baseUrl.replace(":", "%3A").replace("/", "%2F") + "%2Fapi%2Fvdc%2Fv1%3BlinkType%3D%3D0";
        enqueueJson("{\"total\":3,\"page\":1,\"pageSize\":2,\"record\":[{\"name\":\"a\"},{\"name\":\"b\"}],"
                + "\"link\":[{\"rel\":\"nextPage\",\"href\":\"" + secondPage + "\"},"
                + "{\"rel\":\"lastPage\",\"href\":\"" + secondPage + "\"}]}");
        enqueueJson("{\"total\":3,\"page\":2,\"pageSize\":2,\"record\":[{\"name\":\"c\"}],"
                + "\"link\":[{\"rel\":\"previousPage\",\"href\":\"" + baseUrl + "/api/query?page=1\"}]}");

        // --- Act ---
        List<NetworkSummary> networks = vdc.listDirectNetworks();

        // --- Assert ---
        assertThat(networks).extracting(NetworkSummary::name).containsExactly("a", "b", "c");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
        mockWebServer.takeRequest();
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo(secondPage.substring(baseUrl.length()));
    }

    @Test
    void deleteIsolatedNetwork_whenNameIsOnLaterPage_shouldStillDelete() throws Exception {
        enqueueJson("{\"record\":[{\"name\":\"other\",\"href\":\"" + baseUrl + "/api/admin/network/o\"}],"
                + "\"link\":[{\"rel\":\"nextPage\",\"href\":\"" + baseUrl + "/api/query?type=orgVdcNetwork&page=2\"}]}");
        enqueueJson("{\"record\":[{\"name\":\"lab;net,2\",\"href\":\"" + baseUrl + "/api/admin/network/n2\"}]}");
        enqueueJson("{\"href\":\"" + baseUrl + "/api/task/5\",\"status\":\"queued\"}");

        vdc.deleteIsolatedNetwork("lab;net,2", false);

        String query = decodedPath(mockWebServer.takeRequest());
        assertThat(query).doesNotContain("lab;net");
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/api/query?type=orgVdcNetwork&page=2");
        RecordedRequest delete = mockWebServer.takeRequest();
        assertThat(delete.getMethod()).isEqualTo("DELETE");
        assertThat(delete.getPath()).isEqualTo("/api/admin/network/n2");
    }
}
