package de.mirkosertic.contactbench.benchmark;

import com.google.common.io.Resources;
import de.mirkosertic.contactbench.schema.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads scenario catalogues from YAML.
 * <pre>
 * defaults:
 *   repetitions: 10
 * scenarios:
 *   - name: filter_by_name
 *     entity: appuser
 *     paginated: true
 *     params:
 *       first_name__icontains: John
 *   - name: pagination_selected_pages
 *     params:
 *       page_size: 1000
 *     variants: [first, middle, last]
 *     random-pages: 10
 * </pre>
 * {@code entity} defaults to {@code appuser} and {@code paginated} to true. A scenario listing
 * variants gets {@code random-pages} additional random pages, falling back to the configured
 * default when the key is absent.
 */
public class ScenarioCatalogueLoader {

    private static final Logger logger = LoggerFactory.getLogger(ScenarioCatalogueLoader.class);

    public static final String DEFAULT_CATALOGUE = "scenarios.yaml";

    private final int defaultRandomPages;

    public ScenarioCatalogueLoader(final int defaultRandomPages) {
        this.defaultRandomPages = defaultRandomPages;
    }

    /**
     * Loads the catalogue bundled on the classpath.
     */
    public List<BenchmarkScenario> loadDefault() throws IOException {
        final URL url = Resources.getResource(DEFAULT_CATALOGUE);
        return parse(Resources.toString(url, StandardCharsets.UTF_8), DEFAULT_CATALOGUE);
    }

    public List<BenchmarkScenario> load(final Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    /**
     * @throws IllegalArgumentException if the catalogue is malformed
     */
    List<BenchmarkScenario> parse(final String yamlText, final String source) {
        final Object root = new Yaml().load(yamlText);
        if (!(root instanceof Map<?, ?> document) || !(document.get("scenarios") instanceof List<?> entries)) {
            throw new IllegalArgumentException("Scenario catalogue " + source + " has no 'scenarios' list");
        }

        int defaultRepetitions = 1;
        if (document.get("defaults") instanceof Map<?, ?> defaults && defaults.get("repetitions") != null) {
            defaultRepetitions = toInt(defaults.get("repetitions"), "defaults.repetitions", source);
        }

        final List<BenchmarkScenario> scenarios = new ArrayList<>();
        final Set<String> names = new HashSet<>();
        for (final Object entry : entries) {
            if (!(entry instanceof Map<?, ?> scenario)) {
                throw new IllegalArgumentException("Scenario catalogue " + source + " contains a non-mapping entry");
            }
            final BenchmarkScenario parsed = toScenario(scenario, defaultRepetitions, source);
            if (!names.add(parsed.name())) {
                throw new IllegalArgumentException("Duplicate scenario '" + parsed.name() + "' in " + source);
            }
            scenarios.add(parsed);
        }

        logger.info("Loaded {} scenarios from {}", scenarios.size(), source);
        return scenarios;
    }

    private BenchmarkScenario toScenario(final Map<?, ?> entry, final int defaultRepetitions, final String source) {
        final Object name = entry.get("name");
        if (name == null) {
            throw new IllegalArgumentException("Scenario without name in " + source);
        }
        final String scenarioName = name.toString();
        final String where = source + ", scenario '" + scenarioName + "'";

        final Object entityName = entry.get("entity");
        final EntityType entity = entityName == null ? EntityType.APP_USER : EntityType.fromName(entityName.toString());

        final int repetitions = entry.get("repetitions") == null
                ? defaultRepetitions
                : toInt(entry.get("repetitions"), "repetitions", where);
        final boolean paginated = entry.get("paginated") == null || Boolean.parseBoolean(entry.get("paginated").toString());

        final Map<String, String> params = new LinkedHashMap<>();
        if (entry.get("params") instanceof Map<?, ?> rawParams) {
            rawParams.forEach((key, value) -> params.put(key.toString(), value == null ? "" : value.toString()));
        }

        final List<PageVariant> variants = new ArrayList<>();
        if (entry.get("variants") instanceof List<?> rawVariants) {
            for (final Object variant : rawVariants) {
                variants.add(PageVariant.fromName(variant.toString()));
            }
            final int randomPages = entry.get("random-pages") == null
                    ? defaultRandomPages
                    : toInt(entry.get("random-pages"), "random-pages", where);
            for (int i = 0; i < randomPages; i++) {
                variants.add(PageVariant.RANDOM);
            }
        }

        return new BenchmarkScenario(scenarioName, entity, params, repetitions, paginated, variants);
    }

    private static int toInt(final Object value, final String key, final String where) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be a number in " + where + ", got '" + value + "'", e);
        }
    }
}
