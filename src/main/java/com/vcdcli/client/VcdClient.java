package com.vcdcli.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.exception.VcdCliException;
import com.vcdcli.model.TaskResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A thin JSON client for the vCloud Director REST API.
 * <p>
 * The underlying {@link WebClient} is already bound to one endpoint, API version and session
 * token (see {@link VcdClientFactory}). This class issues plain requests, walks query-service
 * pages and translates HTTP failures into {@link VcdCliException}s. It never retries and never
 * polls tasks.
 */
@Slf4j
public class VcdClient {

    public static final String AUTH_HEADER = "x-vcloud-authorization";

    public static final String EXTERNAL_NETWORK_TYPE = "application/vnd.vmware.admin.vmwexternalnet+json";
    public static final String ORG_VDC_NETWORK_TYPE = "application/vnd.vmware.vcloud.orgVdcNetwork+json";

    private final WebClient webClient;
    private final int pageSize;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public VcdClient(WebClient webClient, int pageSize) {
        this.webClient = webClient;
        this.pageSize = pageSize;
    }

    public JsonNode get(String uri) {
        return exchange("GET " + uri, () -> webClient.get().uri(uri)
                .retrieve().bodyToMono(JsonNode.class).block());
    }

    /**
     * Runs a query-service request in records format and collects the records of every page,
     * following the {@code nextPage} link of each result until the server stops sending one.
     *
     * @param type   The query type, e.g. {@code orgVdcNetwork}.
     * @param filter The FIQL filter, or {@code null} for none.
     * @return All matching records, in server order.
     */
    public ArrayNode query(String type, String filter) {
        ArrayNode records = JsonNodeFactory.instance.arrayNode();
        JsonNode page = exchange("query " + type, () -> webClient.get()
                .uri(builder -> {
                    builder.path("/api/query")
                            .queryParam("type", type)
                            .queryParam("format", "records")
                            .queryParam("pageSize", pageSize);
                    if (filter == null) {
                        return builder.build();
                    }
                    return builder.queryParam("filter", "{filter}").build(filter);
                })
                .retrieve().bodyToMono(JsonNode.class).block());
        while (page != null) {
            page.path("record").forEach(records::add);
            Optional<URI> next = nextPage(page);
            if (next.isEmpty()) {
                break;
            }
            log.debug("Following query page {} of {} records", next.get(), page.path("total").asText("?"));
            // the link is already encoded by the server
            page = exchange("query " + type, () -> webClient.get().uri(next.get())
                    .retrieve().bodyToMono(JsonNode.class).block());
        }
        return records;
    }

    static Optional<URI> nextPage(JsonNode page) {
        for (JsonNode link : page.path("link")) {
            if ("nextPage".equals(link.path("rel").asText()) && !link.path("href").asText().isBlank()) {
                return Optional.of(URI.create(link.path("href").asText()));
            }
        }
        return Optional.empty();
    }

    public JsonNode post(String uri, String contentType, JsonNode body) {
        return exchange("POST " + uri, () -> webClient.post().uri(uri)
                .contentType(MediaType.parseMediaType(contentType))
                .bodyValue(body)
                .retrieve().bodyToMono(JsonNode.class).block());
    }

    public JsonNode put(String uri, String contentType, JsonNode body) {
        return exchange("PUT " + uri, () -> webClient.put().uri(uri)
                .contentType(MediaType.parseMediaType(contentType))
                .bodyValue(body)
                .retrieve().bodyToMono(JsonNode.class).block());
    }

    public JsonNode delete(String uri) {
        return exchange("DELETE " + uri, () -> webClient.delete().uri(uri)
                .retrieve().bodyToMono(JsonNode.class).block());
    }

    /**
     * Extracts the first task embedded in a resource returned by a create or update call.
     *
     * @param resource The resource representation.
     * @return The first queued task.
     * @throws VcdCliException if the response carries no task.
     */
    public static TaskResult firstTask(JsonNode resource) {
        JsonNode task = resource == null ? null : resource.path("tasks").path("task").path(0);
        if (task == null || task.isMissingNode()) {
            throw new VcdCliException(ErrorKind.REMOTE_REJECTED, "The server response did not include a task.");
        }
        return toTask(task);
    }

    public static TaskResult toTask(JsonNode task) {
        if (task == null || task.isMissingNode() || task.isNull()) {
            throw new VcdCliException(ErrorKind.REMOTE_REJECTED, "The server response did not include a task.");
        }
        return new TaskResult(
                task.path("href").asText(null),
                task.path("id").asText(null),
                task.path("operationName").asText(null),
                task.path("operation").asText(null),
                task.path("status").asText(null));
    }

    /**
     * Finds the element of a reference or record array whose {@code name} matches exactly.
     */
    public static Optional<JsonNode> findByName(JsonNode elements, String name) {
        for (JsonNode element : elements) {
            if (name.equals(element.path("name").asText())) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    private JsonNode exchange(String description, Supplier<JsonNode> call) {
        try {
            return call.get();
        } catch (WebClientResponseException e) {
            log.debug("{} failed with status {} and body: {}", description, e.getStatusCode(), e.getResponseBodyAsString());
            throw translate(e);
        } catch (WebClientRequestException e) {
            log.debug("{} could not be sent", description, e);
            throw new VcdCliException(ErrorKind.CONNECTION_FAILURE,
                    "Could not reach vCloud Director: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private VcdCliException translate(WebClientResponseException e) {
        String message = serverMessage(e);
        if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()
                || e.getStatusCode().value() == HttpStatus.FORBIDDEN.value()) {
            return new VcdCliException(ErrorKind.AUTH_FAILURE,
                    "Access denied (" + e.getStatusCode().value() + "): " + message, e);
        }
        return new VcdCliException(ErrorKind.REMOTE_REJECTED, message, e);
    }

    private String serverMessage(WebClientResponseException e) {
        String body = e.getResponseBodyAsString();
        if (!body.isBlank()) {
            try {
                String message = objectMapper.readTree(body).path("message").asText("");
                if (!message.isBlank()) {
                    return message;
                }
            } catch (Exception parseFailure) {
                log.debug("Error body is not JSON: {}", body);
            }
        }
        return e.getStatusCode().value() + " " + e.getStatusText();
    }
}
