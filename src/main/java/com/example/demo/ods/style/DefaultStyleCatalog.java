package com.example.demo.ods.style;

import com.example.demo.ods.config.OdsProperties;
import com.example.demo.ods.exception.ResourceLoadingException;
import com.example.demo.ods.model.StyleSpec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Built-in styles written into every document (table, row and column formats,
 * the data styles and the per value type cell styles). Their names are protected:
 * registering a style under one of them never replaces the existing record.
 */
@Slf4j
@Component
public class DefaultStyleCatalog {

    private final List<StyleSpec> specs;
    private final Set<String> protectedNames;

    @Autowired
    public DefaultStyleCatalog(OdsProperties properties) {
        this(load(properties.getDefaultStylesResource()));
    }

    public DefaultStyleCatalog(List<StyleSpec> specs) {
        this.specs = Collections.unmodifiableList(specs);
        Set<String> names = new LinkedHashSet<>();
        for (StyleSpec spec : specs) {
            names.add(spec.name());
        }
        this.protectedNames = Collections.unmodifiableSet(names);
    }

    /** In registration order; data styles precede the cell styles referring to them. */
    public List<StyleSpec> specs() {
        return specs;
    }

    public Set<String> protectedNames() {
        return protectedNames;
    }

    private static List<StyleSpec> load(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new ResourceLoadingException(ResourceLoadingException.RESOURCE_NOT_FOUND,
                    "Default style resource not found: " + path);
        }
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = resource.getInputStream()) {
            List<StyleSpec> specs = yamlMapper.readValue(in, new TypeReference<List<StyleSpec>>() { });
            log.info("Loaded {} built-in styles from {}", specs.size(), path);
            return specs;
        } catch (IOException e) {
            throw new ResourceLoadingException(ResourceLoadingException.RESOURCE_UNREADABLE,
                    "Failed to read default style resource " + path, e);
        }
    }
}
