package com.formula.table;

import com.formula.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads atomic mass tables from YAML files.
 * <p>
 * Expected layout (the {@code atomic-masses} section may also be the document root):
 * <pre>
 * atomic-masses:
 *   "H": 1.0079
 *   "He": 4.0026
 * </pre>
 * Symbols should be quoted: YAML reads a bare {@code No} (nobelium) as a boolean.
 */
public class AtomicMassTableLoader {

    private static final Logger log = LoggerFactory.getLogger(AtomicMassTableLoader.class);

    private static final String SECTION = "atomic-masses";

    /**
     * Load a table from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the table file
     * @return Loaded table
     */
    public static AtomicMassTable load(String path) {
        log.info("Loading atomic mass table from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                AtomicMassTable table = parseYaml(inputStream, path);
                log.info("Loaded atomic mass table with {} elements from {}", table.size(), path);
                return table;
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load atomic mass table from: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed atomic mass table in: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static AtomicMassTable parseYaml(InputStream inputStream, String path) {
        Yaml yaml = new Yaml();
        Object document = yaml.load(inputStream);

        if (document == null) {
            throw new ConfigurationException("Atomic mass table is empty: " + path);
        }
        if (!(document instanceof Map)) {
            throw new ConfigurationException("Atomic mass table must be a mapping: " + path);
        }

        Map<Object, Object> root = (Map<Object, Object>) document;
        Object section = root.containsKey(SECTION) ? root.get(SECTION) : root;
        if (!(section instanceof Map)) {
            throw new ConfigurationException("'" + SECTION + "' must be a mapping in: " + path);
        }

        Map<String, Number> masses = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) section).entrySet()) {
            String symbol = String.valueOf(entry.getKey());
            masses.put(symbol, getNumber(symbol, entry.getValue(), path));
            log.trace("Parsed atomic mass: {}={}", symbol, entry.getValue());
        }

        return AtomicMassTable.of(masses);
    }

    // Helper methods

    private static Number getNumber(String symbol, Object value, String path) {
        if (value instanceof Number number) {
            return number;
        }
        if (value == null) {
            throw new ConfigurationException("Missing atomic mass for '" + symbol + "' in: " + path);
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Atomic mass of '" + symbol + "' is not a number: '"
                    + value + "' in: " + path, e);
        }
    }
}
