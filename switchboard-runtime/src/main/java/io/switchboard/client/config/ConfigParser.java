/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads a {@link SwitchboardConfig} from YAML. Missing keys take their defaults, unknown keys
 * are rejected.
 */
public class ConfigParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigParser.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public SwitchboardConfig parseConfiguration(String yaml) {
        try {
            JsonNode root = mapper.readTree(yaml);
            // an empty or comment-only document
            if (root == null || root.isMissingNode() || root.isNull()) {
                return SwitchboardConfig.defaults();
            }
            return mapper.treeToValue(root, SwitchboardConfig.class);
        }
        catch (JsonProcessingException e) {
            throw toConfigurationException(e);
        }
    }

    public SwitchboardConfig parseConfiguration(Path path) {
        LOGGER.debug("Reading configuration from {}", path);
        String yaml;
        try {
            yaml = Files.readString(path);
        }
        catch (IOException e) {
            throw new IllegalConfigurationException("Couldn't read configuration file " + path, e);
        }
        return parseConfiguration(yaml);
    }

    private static IllegalConfigurationException toConfigurationException(JsonProcessingException e) {
        // range checks in the record constructor surface wrapped by Jackson
        if (e.getCause() instanceof IllegalConfigurationException ice) {
            return ice;
        }
        return new IllegalConfigurationException("Couldn't parse configuration: " + e.getOriginalMessage(), e);
    }
}
