package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.tool.AgentTool;
import com.deepansh.kernel.tool.ToolContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP fetch tool.
 *
 * Security controls:
 * - Scheme allowlist (http/https by default)
 * - NetConnect(host:port) capability per call
 * - Hosts resolving to loopback, private, link-local or multicast addresses are refused
 * - Redirects are not followed (see HttpClientConfig), so a public URL cannot bounce inward
 * - Only GET, POST, PUT, PATCH
 */
@Component
@Slf4j
public class WebFetchTool implements AgentTool {

    private static final List<String> ALLOWED_METHODS = List.of("GET", "POST", "PUT", "PATCH");

    private final KernelProperties.Tools.Web config;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public WebFetchTool(KernelProperties properties, ObjectMapper objectMapper, RestClient.Builder restClientBuilder) {
        this.config = properties.getTools().getWeb();
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .requestInterceptor((request, body, execution) -> {
                    log.debug("Outbound fetch: {} {}", request.getMethod(), request.getURI());
                    return execution.execute(request, body);
                })
                .build();
    }

    @Override
    public String getName() {
        return "web_fetch";
    }

    @Override
    public String getDescription() {
        return """
                Make an HTTP request and return the status and body.
                Supports GET, POST, PUT, PATCH. Private and loopback addresses are not reachable.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "url", Map.of("type", "string", "description", "Full URL, e.g. https://api.github.com/repos/owner/repo"),
                        "method", Map.of("type", "string", "enum", ALLOWED_METHODS, "description", "HTTP method. Default: GET"),
                        "headers", Map.of("type", "object", "description", "Request headers",
                                "additionalProperties", Map.of("type", "string")),
                        "body", Map.of("type", "string", "description", "Request body (for POST/PUT/PATCH)")
                ),
                "required", List.of("url")
        );
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        URI uri = parse(ToolArgs.required(arguments, "url"));
        return List.of(Capability.netConnect(uri.getHost().toLowerCase(Locale.ROOT) + ":" + port(uri)));
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        URI uri = parse(ToolArgs.required(arguments, "url"));
        String method = ToolArgs.optional(arguments, "method", "GET").toUpperCase(Locale.ROOT);
        if (!ALLOWED_METHODS.contains(method)) {
            throw new IllegalArgumentException("Method '" + method + "' is not allowed. Use: " + ALLOWED_METHODS);
        }
        rejectPrivateAddress(uri.getHost());

        log.info("Fetch: {} {}", method, uri);
        var request = restClient.method(HttpMethod.valueOf(method)).uri(uri);

        if (arguments.get("headers") instanceof Map<?, ?> headers) {
            headers.forEach((k, v) -> request.header(k.toString(), String.valueOf(v)));
        }
        String body = ToolArgs.optional(arguments, "body", null);
        if (body != null && !body.isBlank() && !method.equals("GET")) {
            request.contentType(MediaType.APPLICATION_JSON).body(body);
        }

        ResponseEntity<String> response = request.retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> { })
                .toEntity(String.class);

        int status = response.getStatusCode().value();
        String formatted = tryPrettyPrint(response.getBody());
        if (formatted != null && formatted.length() > config.getMaxResponseChars()) {
            formatted = formatted.substring(0, config.getMaxResponseChars())
                    + "\n... [truncated " + (formatted.length() - config.getMaxResponseChars()) + " chars]";
        }
        log.info("Fetch response: status={} length={}", status, formatted != null ? formatted.length() : 0);
        return String.format("HTTP %d\n\n%s", status, formatted != null ? formatted : "(empty response)");
    }

    private URI parse(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!config.getAllowedSchemeList().contains(scheme)) {
            throw new IllegalArgumentException("Scheme '" + scheme + "' is not allowed. Allowed: "
                    + config.getAllowedSchemeList());
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }
        return uri;
    }

    private int port(URI uri) {
        if (uri.getPort() > 0) return uri.getPort();
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    static void rejectPrivateAddress(String host) throws UnknownHostException {
        for (InetAddress address : InetAddress.getAllByName(host)) {
            if (isPrivate(address)) {
                throw new SecurityException("Host '" + host + "' resolves to a non-public address " + address.getHostAddress());
            }
        }
    }

    static boolean isPrivate(InetAddress address) {
        if (address.isLoopbackAddress() || address.isAnyLocalAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        byte[] raw = address.getAddress();
        // IPv6 unique local fc00::/7
        if (raw.length == 16 && (raw[0] & 0xFE) == 0xFC) return true;
        // IPv4 carrier-grade NAT 100.64.0.0/10
        return raw.length == 4 && (raw[0] & 0xFF) == 100 && (raw[1] & 0xC0) == 64;
    }

    private String tryPrettyPrint(String body) {
        if (body == null) return null;
        try {
            Object parsed = objectMapper.readValue(body, Object.class);
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(parsed);
        } catch (Exception e) {
            return body;
        }
    }
}
