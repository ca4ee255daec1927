/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.integration.alma;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.almasync.config.AlmaInstance;
import villagecompute.almasync.exceptions.ExternalServiceException;

/**
 * HTTP client for the ALMA scorecard API.
 *
 * <p>
 * <b>Upload flow:</b>
 * <ol>
 * <li>{@code POST session} with backend, username and password; the session cookie comes back in
 * {@code Set-Cookie}</li>
 * <li>{@code PUT scorecard/{id}/upload/dhis} as {@code multipart/form-data}, field {@code file}, file name
 * {@code temp.json}, content {@code {"dataValues": [...]}}</li>
 * </ol>
 */
@ApplicationScoped
public class AlmaClient {

    private static final Logger LOG = Logger.getLogger(AlmaClient.class);

    static final String UPLOAD_FIELD = "file";
    static final String UPLOAD_FILENAME = "temp.json";

    @ConfigProperty(
            name = "almasync.http.timeout",
            defaultValue = "PT60S")
    Duration timeout;

    @Inject
    ObjectMapper objectMapper;

    private HttpClient httpClient;

    public AlmaClient() {
    }

    AlmaClient(ObjectMapper objectMapper, Duration timeout) {
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        init();
    }

    @PostConstruct
    void init() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    /**
     * Opens an ALMA session.
     *
     * @return {@code Cookie} header value carrying the session
     * @throws ExternalServiceException
     *             if login fails or no cookie is returned
     */
    public String login(AlmaInstance instance) {
        ObjectNode credentials = objectMapper.createObjectNode();
        credentials.put("backend", instance.backend());
        credentials.put("username", instance.username());
        credentials.put("password", instance.password());

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(baseUrl(instance) + "/session"))
                    .timeout(timeout).header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(credentials))).build();
            response = send(instance, request, "login");
        } catch (IOException e) {
            throw new ExternalServiceException("Could not build ALMA login request: " + e.getMessage(), e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new ExternalServiceException(
                    "ALMA " + instance.name() + " login failed with status " + response.statusCode(),
                    response.statusCode());
        }

        List<String> cookies = response.headers().allValues("set-cookie");
        if (cookies.isEmpty()) {
            throw new ExternalServiceException("ALMA " + instance.name() + " login returned no session cookie");
        }
        LOG.debugf("Opened ALMA session on %s", instance.name());
        return cookies.stream().map(cookie -> cookie.split(";", 2)[0].trim()).collect(Collectors.joining("; "));
    }

    /**
     * Uploads one analytics slice to a scorecard.
     *
     * @param instance
     *            target instance
     * @param sessionCookie
     *            value returned by {@link #login(AlmaInstance)}
     * @param scorecard
     *            scorecard id
     * @param dataValue
     *            analytics slice, wrapped as a single-element {@code dataValues} batch
     * @throws ExternalServiceException
     *             on non-2xx answers (the status is kept so callers can re-authenticate on 401/403)
     */
    public void upload(AlmaInstance instance, String sessionCookie, int scorecard, JsonNode dataValue) {
        ObjectNode batch = objectMapper.createObjectNode();
        batch.putArray("dataValues").add(dataValue);

        String boundary = "alma-sync-" + UUID.randomUUID();
        byte[] body;
        try {
            body = multipartBody(boundary, objectMapper.writeValueAsBytes(batch));
        } catch (IOException e) {
            throw new ExternalServiceException("Could not encode ALMA upload: " + e.getMessage(), e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl(instance) + "/scorecard/" + scorecard + "/upload/dhis")).timeout(timeout)
                .header("Cookie", sessionCookie).header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .PUT(HttpRequest.BodyPublishers.ofByteArray(body)).build();

        HttpResponse<String> response = send(instance, request, "upload to scorecard " + scorecard);
        if (response.statusCode() / 100 != 2) {
            throw new ExternalServiceException("ALMA " + instance.name() + " rejected upload to scorecard " + scorecard
                    + " with status " + response.statusCode(), response.statusCode());
        }
    }

    /**
     * @return true if the error means the session is no longer valid
     */
    public static boolean isAuthenticationFailure(ExternalServiceException e) {
        return e.getStatusCode() == 401 || e.getStatusCode() == 403;
    }

    private HttpResponse<String> send(AlmaInstance instance, HttpRequest request, String what) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ExternalServiceException(
                    "ALMA " + instance.name() + " timed out after " + timeout.toSeconds() + "s on " + what, e);
        } catch (IOException e) {
            throw new ExternalServiceException("ALMA " + instance.name() + " " + what + " failed: " + e.getMessage(),
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Interrupted during ALMA " + what, e);
        }
    }

    private static byte[] multipartBody(String boundary, byte[] content) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String head = "--" + boundary + "\r\n" + "Content-Disposition: form-data; name=\"" + UPLOAD_FIELD
                + "\"; filename=\"" + UPLOAD_FILENAME + "\"\r\n" + "Content-Type: application/json\r\n\r\n";
        out.write(head.getBytes(StandardCharsets.UTF_8));
        out.write(content);
        out.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    private static String baseUrl(AlmaInstance instance) {
        String url = instance.url();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
