/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.almasync.exceptions.ConfigurationException;

/**
 * Static registry of the DHIS2 and ALMA instances a schedule may reference by name.
 *
 * <p>
 * Loaded once at startup from the JSON file named by {@code almasync.instances.file}. The file is looked up on the
 * filesystem first and on the classpath second:
 *
 * <pre>
 * {
 *   "dhis2-instances": { "play": { "url": "...", "username": "...", "password": "..." } },
 *   "alma-instances":  { "alma": { "url": "...", "username": "...", "password": "...", "backend": "..." } }
 * }
 * </pre>
 *
 * <p>
 * A missing file leaves the registry empty (every start then fails with a configuration error); a malformed file or
 * an entry without {@code url} fails startup.
 */
@ApplicationScoped
@Startup
public class InstanceRegistry {

    private static final Logger LOG = Logger.getLogger(InstanceRegistry.class);

    static final String DHIS2_SECTION = "dhis2-instances";
    static final String ALMA_SECTION = "alma-instances";

    @ConfigProperty(
            name = "almasync.instances.file",
            defaultValue = "configuration.json")
    String instancesFile;

    @Inject
    ObjectMapper objectMapper;

    private volatile Map<String, Dhis2Instance> dhis2Instances = Map.of();
    private volatile Map<String, AlmaInstance> almaInstances = Map.of();

    /**
     * Builds a registry with fixed contents, bypassing file loading.
     */
    public static InstanceRegistry of(Map<String, Dhis2Instance> dhis2, Map<String, AlmaInstance> alma) {
        InstanceRegistry registry = new InstanceRegistry();
        registry.dhis2Instances = Map.copyOf(dhis2);
        registry.almaInstances = Map.copyOf(alma);
        return registry;
    }

    /**
     * Loads the instances file.
     *
     * @throws ConfigurationException
     *             if the file exists but cannot be parsed or declares an instance without a URL
     */
    @PostConstruct
    public void load() {
        Optional<JsonNode> root = readRoot();
        if (root.isEmpty()) {
            LOG.warnf("Instance configuration %s not found; no DHIS2 or ALMA instances are available", instancesFile);
            return;
        }

        Map<String, Dhis2Instance> dhis2 = new LinkedHashMap<>();
        forEachEntry(root.get(), DHIS2_SECTION, (name, node) -> dhis2.put(name, new Dhis2Instance(name,
                requireUrl(DHIS2_SECTION, name, node), text(node, "username"), text(node, "password"))));

        Map<String, AlmaInstance> alma = new LinkedHashMap<>();
        forEachEntry(root.get(), ALMA_SECTION,
                (name, node) -> alma.put(name, new AlmaInstance(name, requireUrl(ALMA_SECTION, name, node),
                        text(node, "username"), text(node, "password"), text(node, "backend"))));

        this.dhis2Instances = Collections.unmodifiableMap(dhis2);
        this.almaInstances = Collections.unmodifiableMap(alma);
        LOG.infof("Loaded instance configuration from %s: DHIS2 %s, ALMA %s", instancesFile, dhis2.keySet(),
                alma.keySet());
    }

    public Optional<Dhis2Instance> findDhis2(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(dhis2Instances.get(name));
    }

    public Optional<AlmaInstance> findAlma(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(almaInstances.get(name));
    }

    /**
     * @throws ConfigurationException
     *             naming the instance when it is not configured
     */
    public Dhis2Instance requireDhis2(String name) {
        return findDhis2(name).orElseThrow(() -> ConfigurationException.missingInstance("DHIS2", name));
    }

    /**
     * @throws ConfigurationException
     *             naming the instance when it is not configured
     */
    public AlmaInstance requireAlma(String name) {
        return findAlma(name).orElseThrow(() -> ConfigurationException.missingInstance("ALMA", name));
    }

    public Set<String> getDhis2InstanceNames() {
        return dhis2Instances.keySet();
    }

    public Set<String> getAlmaInstanceNames() {
        return almaInstances.keySet();
    }

    private Optional<JsonNode> readRoot() {
        Path path = Path.of(instancesFile);
        try {
            if (Files.isRegularFile(path)) {
                return Optional.of(objectMapper.readTree(path.toFile()));
            }
            try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(instancesFile)) {
                if (in == null) {
                    return Optional.empty();
                }
                return Optional.of(objectMapper.readTree(in));
            }
        } catch (IOException e) {
            String errorMessage = "Instance configuration " + instancesFile + " could not be read: " + e.getMessage();
            LOG.fatal(errorMessage);
            throw new ConfigurationException(errorMessage, e);
        }
    }

    private static void forEachEntry(JsonNode root, String section, BiConsumer<String, JsonNode> consumer) {
        JsonNode entries = root.path(section);
        if (!entries.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            consumer.accept(entry.getKey(), entry.getValue());
        }
    }

    private static String requireUrl(String section, String name, JsonNode node) {
        String url = text(node, "url");
        if (url == null || url.isBlank()) {
            String errorMessage = section + "." + name + " has no url";
            LOG.fatal(errorMessage);
            throw new ConfigurationException(errorMessage);
        }
        return url;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
