package com.example.routines.docgen.service;

import com.example.routines.docgen.aspect.LogExecutionTime;
import com.example.routines.docgen.config.CacheConfig;
import com.example.routines.docgen.exception.TemplateLoadingException;
import com.example.routines.docgen.model.TemplateConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads template definitions from JSON or YAML files.
 *
 * An id is looked up as a filesystem path first, then under the classpath
 * {@code templates/} folder; ids without an extension try {@code .yaml},
 * {@code .yml} and {@code .json} in that order.
 */
@Slf4j
@Component
public class TemplateLoader {
    static final String CLASSPATH_ROOT = "templates/";
    private static final List<String> EXTENSIONS = List.of(".yaml", ".yml", ".json");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Load and parse a template definition.
     *
     * @param templateId file name or path of the template
     * @return the parsed template
     */
    @LogExecutionTime("Loading Template Definition")
    @Cacheable(value = CacheConfig.TEMPLATE_CONFIGS, key = "#templateId")
    public TemplateConfig loadTemplate(String templateId) {
        return TemplateConfig.from(loadRawTemplate(templateId));
    }

    /**
     * The template definition as plain maps and lists, uncached.
     */
    public Map<String, Object> loadRawTemplate(String templateId) {
        if (templateId == null || templateId.trim().isEmpty()) {
            throw new TemplateLoadingException(TemplateLoadingException.TEMPLATE_NOT_FOUND,
                    "Template id cannot be null or empty");
        }
        for (String candidate : candidatePaths(templateId.trim())) {
            File file = new File(candidate);
            if (file.isFile()) {
                log.info("Loading template from filesystem: {}", candidate);
                try (InputStream in = new FileInputStream(file)) {
                    return parse(in, candidate);
                } catch (IOException e) {
                    throw parseError(candidate, e);
                }
            }
            ClassPathResource resource = new ClassPathResource(CLASSPATH_ROOT + candidate);
            if (resource.exists()) {
                log.info("Loading template from classpath resource: {}", resource.getPath());
                try (InputStream in = resource.getInputStream()) {
                    return parse(in, candidate);
                } catch (IOException e) {
                    throw parseError(candidate, e);
                }
            }
        }
        throw new TemplateLoadingException(TemplateLoadingException.TEMPLATE_NOT_FOUND,
                "Template not found for id '" + templateId + "'. Check src/main/resources/templates.");
    }

    @CacheEvict(value = CacheConfig.TEMPLATE_CONFIGS, allEntries = true)
    public void clearCache() {
        log.info("Clearing template cache");
    }

    private List<String> candidatePaths(String templateId) {
        List<String> candidates = new ArrayList<>();
        candidates.add(templateId);
        if (EXTENSIONS.stream().noneMatch(templateId::endsWith)) {
            for (String extension : EXTENSIONS) {
                candidates.add(templateId + extension);
            }
        }
        return candidates;
    }

    private Map<String, Object> parse(InputStream in, String path) throws IOException {
        ObjectMapper mapper = path.endsWith(".json") ? jsonMapper : yamlMapper;
        Map<String, Object> raw = mapper.readValue(in, MAP_TYPE);
        if (raw == null) {
            throw new TemplateLoadingException(TemplateLoadingException.TEMPLATE_PARSE_ERROR,
                    "Template is empty: " + path);
        }
        return raw;
    }

    private static TemplateLoadingException parseError(String path, IOException e) {
        log.error("Failed to parse template: {}", path, e);
        return new TemplateLoadingException(TemplateLoadingException.TEMPLATE_PARSE_ERROR,
                "Failed to parse template: " + path, e);
    }
}
