package org.burrow.rabbit.topology;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.burrow.rabbit.serialization.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * Minimal client for the RabbitMQ management HTTP API: list a queue's bindings and delete one.
 *
 * <p>Credentials come from the user-info part of the base URI and are sent as HTTP basic auth.</p>
 */
public class ManagementClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final TypeReference<List<Binding>> BINDING_LIST = new TypeReference<>() {};

    private final String baseUrl;
    private final String authorization;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ManagementClient(URI managementUri) {
        this(managementUri,
                HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(),
                JsonCodec.defaultMapper());
    }

    public ManagementClient(URI managementUri, HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl(managementUri);
        this.authorization = basicAuth(managementUri.getUserInfo());
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * {@code GET {base}/queues/{vhost}/{queue}/bindings}
     *
     * @throws IOException on transport failure or a non-2xx status
     */
    public List<Binding> listQueueBindings(String vhost, String queue) throws IOException, InterruptedException {
        String url = baseUrl + "queues/" + encode(vhost) + "/" + encode(queue) + "/bindings";
        HttpResponse<byte[]> response = httpClient.send(request(url).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());
        checkStatus("GET", url, response.statusCode());
        return objectMapper.readValue(response.body(), BINDING_LIST);
    }

    /**
     * {@code DELETE {base}/bindings/{vhost}/e/{source}/q/{destination}/{properties_key}}
     *
     * @throws IOException on transport failure or a non-2xx status
     */
    public void deleteBinding(String vhost, Binding binding) throws IOException, InterruptedException {
        String url = baseUrl + "bindings/" + encode(vhost)
                + "/e/" + encode(binding.source())
                + "/q/" + encode(binding.destination())
                + "/" + binding.propertiesKey();
        HttpResponse<Void> response = httpClient.send(request(url).DELETE().build(),
                HttpResponse.BodyHandlers.discarding());
        checkStatus("DELETE", url, response.statusCode());
    }

    public String baseUrl() {
        return baseUrl;
    }

    private HttpRequest.Builder request(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json");
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder;
    }

    private static void checkStatus(String method, String url, int status) throws IOException {
        if (status < 200 || status >= 300) {
            throw new IOException(method + " " + url + " returned HTTP " + status);
        }
    }

    static String encode(String segment) {
        return URLEncoder.encode(segment == null ? "" : segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String baseUrl(URI uri) {
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getHost());
        if (uri.getPort() > 0) {
            sb.append(':').append(uri.getPort());
        }
        String path = uri.getRawPath();
        if (path != null) {
            sb.append(path);
        }
        if (sb.charAt(sb.length() - 1) != '/') {
            sb.append('/');
        }
        return sb.toString();
    }

    static String basicAuth(String userInfo) {
        if (userInfo == null || userInfo.isEmpty()) {
            return null;
        }
        // password may be absent: "guest" means "guest:"
        String credentials = userInfo.indexOf(':') < 0 ? userInfo + ":" : userInfo;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
