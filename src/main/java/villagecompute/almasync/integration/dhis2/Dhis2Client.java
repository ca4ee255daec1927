/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.integration.dhis2;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.almasync.config.Dhis2Instance;
import villagecompute.almasync.exceptions.ExternalServiceException;

/**
 * HTTP client for the DHIS2 Web API.
 *
 * <p>
 * Two calls are used by a sync pass:
 * <ul>
 * <li>{@code GET indicatorGroups/{group}/indicators.json} - indicator list of a group, fetched once per pass</li>
 * <li>{@code GET analytics.json?dimension=dx:{indicator}&dimension=pe:{period}&dimension=ou:LEVEL-{level}} - one
 * analytics slice per sync unit</li>
 * </ul>
 *
 * <p>
 * Requests authenticate with HTTP basic auth and carry the {@code almasync.http.timeout} timeout. Non-200 answers,
 * I/O errors and timeouts surface as {@link ExternalServiceException}.
 */
@ApplicationScoped
public class Dhis2Client {

    private static final Logger LOG = Logger.getLogger(Dhis2Client.class);

    static final String INDICATOR_FIELDS = "id,name,numerator,denominator,decimals,indicatorType[id,name],annualized";

    @ConfigProperty(
            name = "almasync.http.timeout",
            defaultValue = "PT60S")
    Duration timeout;

    @Inject
    ObjectMapper objectMapper;

    private HttpClient httpClient;

    public Dhis2Client() {
    }

    Dhis2Client(ObjectMapper objectMapper, Duration timeout) {
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        init();
    }

    @PostConstruct
    void init() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    /**
     * Fetches the indicators of an indicator group.
     *
     * @param instance
     *            source instance
     * @param indicatorGroup
     *            indicator group uid
     * @return indicators in response order
     * @throws ExternalServiceException
     *             if the request fails or the response has no {@code indicators} array
     */
    public List<Dhis2Indicator> fetchIndicators(Dhis2Instance instance, String indicatorGroup) {
        String url = baseUrl(instance) + "/indicatorGroups/" + encode(indicatorGroup) + "/indicators.json?fields="
                + encode(INDICATOR_FIELDS) + "&paging=false";

        JsonNode root = get(instance, url, "indicators of group " + indicatorGroup);
        JsonNode items = root.path("indicators");
        if (!items.isArray()) {
            throw new ExternalServiceException(
                    "DHIS2 response for indicator group " + indicatorGroup + " has no indicators array");
        }

        List<Dhis2Indicator> indicators = new ArrayList<>();
        for (JsonNode item : items) {
            indicators.add(new Dhis2Indicator(item.path("id").asText(), item.path("name").asText(null)));
        }
        LOG.debugf("Fetched %d indicators of group %s from %s", indicators.size(), indicatorGroup, instance.name());
        return indicators;
    }

    /**
     * Downloads one analytics slice.
     *
     * @param instance
     *            source instance
     * @param indicatorId
     *            indicator uid ({@code dx} dimension)
     * @param period
     *            DHIS2 period id ({@code pe} dimension)
     * @param level
     *            org unit level ({@code ou:LEVEL-n} dimension)
     * @return the analytics response as returned by DHIS2
     */
    public JsonNode fetchAnalytics(Dhis2Instance instance, String indicatorId, String period, int level) {
        String url = baseUrl(instance) + "/analytics.json?dimension=" + encode("dx:" + indicatorId) + "&dimension="
                + encode("pe:" + period) + "&dimension=" + encode("ou:LEVEL-" + level);
        return get(instance, url, "analytics " + indicatorId + "/" + period + "/LEVEL-" + level);
    }

    private JsonNode get(Dhis2Instance instance, String url, String what) {
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout)
                .header("Authorization", basicAuth(instance)).header("Accept", "application/json").GET().build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ExternalServiceException("DHIS2 " + instance.name() + " returned status "
                        + response.statusCode() + " for " + what, response.statusCode());
            }
            return objectMapper.readTree(response.body());

        } catch (HttpTimeoutException e) {
            throw new ExternalServiceException(
                    "DHIS2 " + instance.name() + " timed out after " + timeout.toSeconds() + "s fetching " + what, e);
        } catch (IOException e) {
            throw new ExternalServiceException("DHIS2 " + instance.name() + " request failed for " + what + ": "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Interrupted fetching " + what + " from DHIS2", e);
        }
    }

    private static String baseUrl(Dhis2Instance instance) {
        String url = instance.url();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String basicAuth(Dhis2Instance instance) {
        String credentials = instance.username() + ":" + instance.password();
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
