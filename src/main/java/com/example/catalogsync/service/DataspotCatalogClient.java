package com.example.catalogsync.service;

import com.example.catalogsync.config.CatalogApiConfig;
import com.example.catalogsync.enums.AssetStatus;
import com.example.catalogsync.exception.RemoteException;
import com.example.catalogsync.model.CatalogPaths;
import com.example.catalogsync.model.TargetAsset;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * REST client for the Dataspot catalog, the production binding of {@link CatalogAccessor}.
 * Supports proxy connectivity and basic authentication.
 */
@Service
public class DataspotCatalogClient implements CatalogAccessor {

    private static final Logger log = LoggerFactory.getLogger(DataspotCatalogClient.class);

    /** Typed scalar fields that are carried as top-level JSON properties */
    static final List<String> ATTRIBUTE_KEYS = List.of("title", "physicalName", "hasRange", "code", "shortText");

    /** JSON properties pointing to the containing asset, by precedence */
    private static final List<String> PARENT_KEYS = List.of("inCollection", "attributeOf", "literalOf", "inScheme");

    private final CatalogApiConfig config;
    private final ObjectMapper objectMapper;
    private final Set<String> schemeUuids = ConcurrentHashMap.newKeySet();
    private WebClient webClient;

    public DataspotCatalogClient(CatalogApiConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        if (config.isConfigured()) {
            this.webClient = createWebClient();
            log.info("Catalog REST client initialized with base URL: {} (database {})", config.getBaseUrl(), config.getDatabase());
        } else {
            log.warn("Catalog integration is not configured. Set catalog.base-url, catalog.username, and catalog.password to enable.");
        }
    }

    private WebClient createWebClient() {
        HttpClient httpClient = createHttpClient();
        String encodedCredentials = createEncodedCredentials();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + encodedCredentials)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    private HttpClient createHttpClient() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectionTimeout())
                .responseTimeout(Duration.ofMillis(config.getReadTimeout()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(config.getReadTimeout(), TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(config.getReadTimeout(), TimeUnit.MILLISECONDS)));

        return configureProxy(httpClient);
    }

    private HttpClient configureProxy(HttpClient httpClient) {
        if (!config.isProxyEnabled() || config.getProxyHost() == null || config.getProxyHost().isEmpty()) {
            return httpClient;
        }

        log.info("Configuring proxy for the catalog: {}:{}", config.getProxyHost(), config.getProxyPort());
        return httpClient.proxy(proxy -> {
            ProxyProvider.Builder proxyBuilder = proxy
                    .type(ProxyProvider.Proxy.HTTP)
                    .host(config.getProxyHost())
                    .port(config.getProxyPort());

            if (config.getProxyUsername() != null && !config.getProxyUsername().isEmpty()) {
                proxyBuilder.username(config.getProxyUsername())
                           .password(s -> config.getProxyPassword());
            }
        });
    }

    private String createEncodedCredentials() {
        String credentials = config.getUsername() + ":" + config.getPassword();
        return Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Check if the client is configured and ready to use.
     */
    public boolean isConfigured() {
        return config.isConfigured() && webClient != null;
    }

    // ======================== Reads ========================

    @Override
    public Optional<TargetAsset> get(String uuid) {
        return fetch(path("assets", uuid), "get").map(this::fromJson);
    }

    @Override
    public List<TargetAsset> listChildren(TargetAsset parent) {
        List<String> paths = childPaths(parent);
        if (paths.isEmpty()) {
            return Collections.emptyList();
        }

        Map<String, TargetAsset> children = new LinkedHashMap<>();
        for (String childPath : paths) {
            Optional<JsonNode> response = fetch(childPath, "listChildren");
            if (response.isEmpty()) {
                continue;
            }
            JsonNode embedded = response.get().path("_embedded");
            Iterator<JsonNode> lists = embedded.elements();
            while (lists.hasNext()) {
                JsonNode list = lists.next();
                if (!list.isArray()) {
                    continue;
                }
                for (JsonNode item : list) {
                    TargetAsset child = fromJson(item);
                    if (child.getUuid() != null) {
                        children.putIfAbsent(child.getUuid(), child);
                    }
                }
            }
        }
        log.debug("Found {} children of {} {}", children.size(), parent.getType(), parent.getUuid());
        return new ArrayList<>(children.values());
    }

    @Override
    public Optional<TargetAsset> resolvePath(String scheme, String collectionPath) {
        StringBuilder endpoint = new StringBuilder(path("schemes", scheme));
        for (String segment : CatalogPaths.split(collectionPath)) {
            endpoint.append("/collections/").append(segment);
        }
        Optional<TargetAsset> resolved = fetch(endpoint.toString(), "resolvePath").map(this::fromJson);
        if (CatalogPaths.split(collectionPath).isEmpty()) {
            resolved.ifPresent(root -> {
                schemeUuids.add(root.getUuid());
                if (root.getType() == null) {
                    root.setType("Scheme");
                }
            });
        }
        if (resolved.isEmpty()) {
            log.warn("Collection '{}' not found in scheme '{}'", collectionPath, scheme);
        }
        return resolved;
    }

    @Override
    public Optional<String> resolveDatatype(String name) {
        return fetch(path("schemes", config.getDatatypeScheme(), "datatypes", name), "resolveDatatype")
                .map(node -> node.path("id").asText(null));
    }

    /**
     * Test connectivity to the catalog API.
     */
    @Override
    public boolean testConnection() {
        if (!isConfigured()) {
            return false;
        }
        try {
            JsonNode response = webClient.get()
                    .uri(uriBuilder -> uriBuilder.path(path("schemes")).build())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
            log.info("Catalog connection test successful");
            return response != null;
        } catch (WebClientException e) {
            log.error("Catalog connection test failed: {}", e.getMessage());
            return false;
        }
    }

    // ======================== Mutations ========================

    @Override
    public TargetAsset create(String parentUuid, TargetAsset payload, AssetStatus status) {
        String endpoint = creationPath(parentUuid, payload.getType());
        ObjectNode body = toJson(payload, status, false);
        log.debug("Catalog create payload for {}: {}", endpoint, body);

        JsonNode response = send(HttpMethod.POST, endpoint, body, "create");
        TargetAsset created = fromJson(response);
        if (created.getUuid() == null) {
            throw new RemoteException("Catalog did not return an id for created " + payload.getType()
                    + " '" + payload.getLabel() + "'", "create");
        }
        if (created.getParentUuid() == null) {
            created.setParentUuid(parentUuid);
        }
        return created;
    }

    @Override
    public TargetAsset update(String uuid, TargetAsset payload, boolean merge, AssetStatus status) {
        ObjectNode body = toJson(payload, status, true);
        log.debug("Catalog {} payload for {}: {}", merge ? "PATCH" : "PUT", uuid, body);
        JsonNode response = send(merge ? HttpMethod.PATCH : HttpMethod.PUT, path("assets", uuid), body, "update");
        TargetAsset updated = fromJson(response);
        return updated.getUuid() != null ? updated : payload.toBuilder().uuid(uuid).build();
    }

    @Override
    public void delete(String uuid) {
        send(HttpMethod.DELETE, path("assets", uuid), null, "delete");
    }

    @Override
    public void markForReview(String uuid) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("status", AssetStatus.MARKED_FOR_REVIEW.getWireValue());
        send(HttpMethod.PATCH, path("assets", uuid), body, "markForReview");
    }

    // ======================== HTTP helpers ========================

    /**
     * GET a resource. 404 and 410 mean "not found" and yield an empty result.
     */
    private Optional<JsonNode> fetch(String endpoint, String operation) {
        requireConfigured(operation);
        try {
            JsonNode response = webClient.get()
                    .uri(uriBuilder -> uriBuilder.path(endpoint).build())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
            return Optional.ofNullable(response);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 404 || status == 410) {
                log.debug("{} {} returned {}", operation, endpoint, status);
                return Optional.empty();
            }
            throw remoteError(e, operation, endpoint);
        } catch (WebClientException e) {
            throw new RemoteException("Catalog request " + endpoint + " failed: " + e.getMessage(), 503, operation, e);
        }
    }

    private JsonNode send(HttpMethod method, String endpoint, JsonNode body, String operation) {
        requireConfigured(operation);
        try {
            WebClient.RequestBodySpec request = webClient.method(method)
                    .uri(uriBuilder -> uriBuilder.path(endpoint).build());
            WebClient.RequestHeadersSpec<?> spec = body != null ? request.bodyValue(body) : request;
            JsonNode response = spec.retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
            return response != null ? response : objectMapper.createObjectNode();
        } catch (WebClientResponseException e) {
            throw remoteError(e, operation, endpoint);
        } catch (WebClientException e) {
            throw new RemoteException("Catalog request " + endpoint + " failed: " + e.getMessage(), 503, operation, e);
        }
    }

    private RemoteException remoteError(WebClientResponseException e, String operation, String endpoint) {
        log.error("Catalog API error on {} {}: {} - {}", operation, endpoint, e.getStatusCode(), e.getResponseBodyAsString());
        return new RemoteException("Catalog API error: " + e.getStatusCode() + " - " + e.getResponseBodyAsString(),
                e.getStatusCode().value(), operation, e);
    }

    private void requireConfigured(String operation) {
        if (!isConfigured()) {
            throw new RemoteException("Catalog integration is not configured. Set catalog.base-url, catalog.username, and catalog.password.",
                    503, operation);
        }
    }

    private String path(String... segments) {
        StringBuilder sb = new StringBuilder(config.getRestPath());
        for (String segment : segments) {
            sb.append('/').append(segment);
        }
        return sb.toString();
    }

    private String creationPath(String parentUuid, String type) {
        boolean underScheme = schemeUuids.contains(parentUuid);
        String container = underScheme ? "schemes" : "collections";
        if (type == null) {
            return path(container, parentUuid, "assets");
        }
        return switch (type) {
            case "Collection" -> path(container, parentUuid, "collections");
            case "ReferenceObject", "Enumeration" -> path(container, parentUuid, "enumerations");
            case "UmlAttribute" -> path("classifiers", parentUuid, "attributes");
            case "ReferenceValue", "Literal" -> path("enumerations", parentUuid, "literals");
            default -> path(container, parentUuid, "assets");
        };
    }

    private List<String> childPaths(TargetAsset parent) {
        if (parent.getType() == null || parent.getUuid() == null) {
            return Collections.emptyList();
        }
        return switch (parent.getType()) {
            case "Collection" -> List.of(path("collections", parent.getUuid(), "collections"),
                    path("collections", parent.getUuid(), "assets"));
            case "Scheme" -> List.of(path("schemes", parent.getUuid(), "collections"),
                    path("schemes", parent.getUuid(), "assets"));
            case "UmlClass" -> List.of(path("classifiers", parent.getUuid(), "attributes"));
            case "ReferenceObject", "Enumeration" -> List.of(path("enumerations", parent.getUuid(), "literals"));
            default -> Collections.emptyList();
        };
    }

    // ======================== JSON mapping ========================

    TargetAsset fromJson(JsonNode node) {
        TargetAsset asset = TargetAsset.builder()
                .uuid(text(node, "id"))
                .type(text(node, "_type"))
                .label(text(node, "label"))
                .description(text(node, "description"))
                .stereotype(text(node, "stereotype"))
                .status(AssetStatus.fromWireValue(text(node, "status")))
                .build();

        for (String parentKey : PARENT_KEYS) {
            String parent = text(node, parentKey);
            if (parent != null && !parent.isEmpty()) {
                asset.setParentUuid(parent);
                break;
            }
        }
        for (String key : ATTRIBUTE_KEYS) {
            String value = text(node, key);
            if (value != null) {
                asset.getAttributes().put(key, value);
            }
        }
        JsonNode customProperties = node.path("customProperties");
        if (customProperties.isObject()) {
            customProperties.fields().forEachRemaining(field ->
                    asset.getCustomProperties().put(field.getKey(), field.getValue().isNull() ? null : field.getValue().asText()));
        }
        return asset;
    }

    ObjectNode toJson(TargetAsset asset, AssetStatus status, boolean includeParent) {
        ObjectNode body = objectMapper.createObjectNode();
        if (asset.getType() != null) {
            body.put("_type", asset.getType());
        }
        if (asset.getLabel() != null) {
            body.put("label", asset.getLabel());
        }
        if (asset.getDescription() != null) {
            body.put("description", asset.getDescription());
        }
        if (asset.getStereotype() != null) {
            body.put("stereotype", asset.getStereotype());
        }
        if (status != null) {
            body.put("status", status.getWireValue());
        }
        if (asset.getAttributes() != null) {
            asset.getAttributes().forEach(body::put);
        }
        if (asset.getCustomProperties() != null && !asset.getCustomProperties().isEmpty()) {
            ObjectNode customProperties = body.putObject("customProperties");
            asset.getCustomProperties().forEach(customProperties::put);
        }
        if (includeParent && asset.getParentUuid() != null) {
            if (schemeUuids.contains(asset.getParentUuid())) {
                body.putNull("inCollection");
                body.put("inScheme", asset.getParentUuid());
            } else {
                body.put("inCollection", asset.getParentUuid());
            }
        }
        return body;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
