package com.hypmag.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hypmag.exception.ConfigurationException;
import com.hypmag.model.FilterColumns;
import com.hypmag.model.HyperbolicConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the JSON filter configuration.
 * <pre>
 * {
 *     "r": {"outname": "HMAG_r", "flux": "FLUX_r", "error": "FLUXERR_r", "magnitude": "MAG_r"},
 *     ...
 * }
 * </pre>
 * Filters are processed in the order they appear in the file.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TypeReference<LinkedHashMap<String, FilterColumns>> FILTER_MAP =
            new TypeReference<LinkedHashMap<String, FilterColumns>>() {
            };

    private final ObjectMapper objectMapper;

    public ConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    public HyperbolicConfig load(Path path) throws IOException {
        log.info("reading configuration from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public HyperbolicConfig load(InputStream in) throws IOException {
        Map<String, FilterColumns> filters;
        try {
            filters = objectMapper.readValue(in, FILTER_MAP);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("malformed configuration: " + e.getOriginalMessage(), e);
        }
        if (filters == null || filters.isEmpty()) {
            throw new ConfigurationException("configuration does not define any filter");
        }
        filters.forEach(ConfigLoader::validate);
        log.debug("configured filters: {}", filters.keySet());
        return new HyperbolicConfig(filters);
    }

    private static void validate(String filter, FilterColumns columns) {
        if (columns == null) {
            throw new ConfigurationException("filter '" + filter + "' has no column definition");
        }
        require(filter, "outname", columns.outname);
        require(filter, "flux", columns.flux);
        require(filter, "error", columns.error);
    }

    private static void require(String filter, String key, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(String.format("filter '%s': missing '%s'", filter, key));
        }
    }

    /**
     * Empty configuration with a description of every entry; the filter block can be
     * repeated for each filter.
     */
    public String template() {
        Map<String, FilterColumns> example = new LinkedHashMap<>();
        example.put("filter_name (e.g. 'r')", new FilterColumns(
                "# output column name (suffix appended for errors: " + FilterColumns.ERROR_SUFFIX + ")",
                "# name of column with flux",
                "# name of column with flux error",
                "# name of column with magnitudes (ignored if a fixed zeropoint is given)"));
        try {
            return objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(example);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render configuration template", e);
        }
    }
}
