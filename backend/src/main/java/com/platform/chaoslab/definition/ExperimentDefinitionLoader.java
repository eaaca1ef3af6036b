package com.platform.chaoslab.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.chaoslab.error.ChaosLabException;
import com.platform.chaoslab.error.DefinitionLoadException;
import com.platform.chaoslab.scheduler.ExperimentDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads experiment definitions from YAML or JSON.
 *
 * Files ending in {@code .yaml} or {@code .yml} are parsed as YAML, anything
 * else as JSON. Unknown properties are ignored.
 */
@Slf4j
@Component
public class ExperimentDefinitionLoader {

    private final ObjectMapper jsonMapper = configure(new ObjectMapper());
    private final ObjectMapper yamlMapper = configure(new ObjectMapper(new YAMLFactory()));

    public ExperimentDefinition load(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DefinitionLoadException(path.toString(), "cannot read file", e);
        }
        log.debug("Loading experiment definition from {}", path);
        return parse(content, isYaml(path), path.toString());
    }

    public ExperimentDefinition parseJson(String content) {
        return parse(content, false, "json");
    }

    public ExperimentDefinition parseYaml(String content) {
        return parse(content, true, "yaml");
    }

    private ExperimentDefinition parse(String content, boolean yaml, String source) {
        ObjectMapper mapper = yaml ? yamlMapper : jsonMapper;
        try {
            ExperimentDefinition definition = mapper.readValue(content, ExperimentDefinition.class);
            if (definition == null) {
                throw new DefinitionLoadException(source, "document is empty", null);
            }
            return definition;
        } catch (JsonProcessingException e) {
            throw new DefinitionLoadException(source, describe(e), e);
        }
    }

    static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    // field errors raised by record constructors arrive wrapped by Jackson
    private static String describe(JsonProcessingException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ChaosLabException chaosLabException) {
            return chaosLabException.getMessage();
        }
        return e.getOriginalMessage() != null ? e.getOriginalMessage() : e.getMessage();
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
