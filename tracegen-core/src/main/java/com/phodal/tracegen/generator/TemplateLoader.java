package com.phodal.tracegen.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.phodal.tracegen.exception.InvalidParameterException;
import com.phodal.tracegen.exception.InvalidTemplateException;
import com.phodal.tracegen.generator.template.TraceTemplate;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads trace templates and parameter lists from JSON or YAML files.
 * <p>
 * Files ending in {@code .yaml} or {@code .yml} are parsed as YAML, everything else as JSON.
 */
@Slf4j
public class TemplateLoader {

    private static final TypeReference<List<TraceParams>> PARAMS_LIST = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public TemplateLoader() {
        this.jsonMapper = configure(new ObjectMapper());
        this.yamlMapper = configure(new YAMLMapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
        return mapper;
    }

    public TraceTemplate loadTemplate(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        log.debug("Loading trace template from {}", path);
        return parseTemplate(content, isYaml(path));
    }

    /**
     * @throws InvalidTemplateException if the content is not a well-formed template
     */
    public TraceTemplate parseTemplate(String content, boolean yaml) {
        try {
            TraceTemplate template = mapper(yaml).readValue(content, TraceTemplate.class);
            if (template == null) {
                throw new InvalidTemplateException("template document is empty");
            }
            return template;
        } catch (JsonProcessingException e) {
            throw new InvalidTemplateException("cannot parse template: " + e.getOriginalMessage());
        }
    }

    public List<TraceParams> loadParams(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        log.debug("Loading trace params from {}", path);
        return parseParams(content, isYaml(path));
    }

    /**
     * Accepts a list of parameter objects or a single object.
     *
     * @throws InvalidParameterException if the content is not a well-formed parameter list
     */
    public List<TraceParams> parseParams(String content, boolean yaml) {
        try {
            List<TraceParams> params = mapper(yaml).readValue(content, PARAMS_LIST);
            return params != null ? params : List.of();
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException("cannot parse trace params: " + e.getOriginalMessage());
        }
    }

    private ObjectMapper mapper(boolean yaml) {
        return yaml ? yamlMapper : jsonMapper;
    }

    private static boolean isYaml(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }
}
