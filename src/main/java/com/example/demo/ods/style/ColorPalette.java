package com.example.demo.ods.style;

import com.example.demo.ods.config.OdsProperties;
import com.example.demo.ods.exception.ResourceLoadingException;
import com.example.demo.ods.exception.StyleValidationException;
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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Named colors mapped to {@code #rrggbb} values, loaded from a YAML classpath resource.
 */
@Slf4j
@Component
public class ColorPalette {

    private static final Pattern HEX_COLOR = Pattern.compile("#[a-fA-F0-9]{6}");

    private final Map<String, String> colors;

    @Autowired
    public ColorPalette(OdsProperties properties) {
        this(load(properties.getPaletteResource()));
    }

    public ColorPalette(Map<String, String> colors) {
        this.colors = Collections.unmodifiableMap(new LinkedHashMap<>(colors));
    }

    /**
     * Maps a color name to its hex value.
     *
     * @throws StyleValidationException when the name is not in the palette
     */
    public String resolve(String name) {
        String hex = colors.get(name);
        if (hex == null) {
            throw new StyleValidationException(StyleValidationException.UNKNOWN_COLOR,
                    "Color '" + name + "' is not known in the palette");
        }
        log.debug("Mapping color {} to {}", name, hex);
        return hex;
    }

    /**
     * Hex values pass through, anything else goes through {@link #resolve}.
     */
    public String toHex(String value) {
        return value.startsWith("#") ? value : resolve(value);
    }

    public static boolean isHex(String value) {
        return HEX_COLOR.matcher(value).find();
    }

    public Map<String, String> asMap() {
        return colors;
    }

    private static Map<String, String> load(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new ResourceLoadingException(ResourceLoadingException.RESOURCE_NOT_FOUND,
                    "Palette resource not found: " + path);
        }
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = resource.getInputStream()) {
            Map<String, String> colors = yamlMapper.readValue(in, new TypeReference<LinkedHashMap<String, String>>() { });
            log.info("Loaded {} palette colors from {}", colors.size(), path);
            return colors;
        } catch (IOException e) {
            throw new ResourceLoadingException(ResourceLoadingException.RESOURCE_UNREADABLE,
                    "Failed to read palette resource " + path, e);
        }
    }
}
