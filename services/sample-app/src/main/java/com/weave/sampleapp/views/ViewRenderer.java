package com.weave.sampleapp.views;

import com.fasterxml.jackson.core.type.TypeReference;
import com.samskivert.mustache.Mustache;
import com.samskivert.mustache.Template;
import com.weave.routing.Json;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

/**
 * Renders Mustache templates from {@code classpath:views/<name>.html}.
 *
 * <p>The model is turned into a property map with the shared Jackson mapper, so {@code {{Name}}}
 * follows the model's JSON property names. Values are HTML-escaped and written as-is, never read
 * as template text. A variable the model does not provide fails the render with a
 * {@link com.samskivert.mustache.MustacheException}.
 */
public class ViewRenderer {

    private static final String DEFAULT_LOCATION = "views/";

    private static final TypeReference<Map<String, Object>> PROPERTIES = new TypeReference<>() {
    };

    private final String location;
    private final Mustache.Compiler compiler;
    private final Map<String, Template> templates = new ConcurrentHashMap<>();

    public ViewRenderer() {
        this(DEFAULT_LOCATION);
    }

    public ViewRenderer(String location) {
        this(Mustache.compiler(), location);
    }

    public ViewRenderer(Mustache.Compiler compiler, String location) {
        this.compiler = compiler;
        this.location = location.endsWith("/") ? location : location + "/";
    }

    /**
     * @param name  template name without extension
     * @param model view model, or null for a template without variables
     * @throws ViewNotFoundException if no such template exists
     */
    public String render(String name, Object model) {
        Map<String, Object> properties = model == null ? Map.of() : Json.mapper().convertValue(model, PROPERTIES);
        return templates.computeIfAbsent(name, this::compile).execute(properties);
    }

    private Template compile(String name) {
        return compiler.compile(load(name));
    }

    private String load(String name) {
        Resource resource = new ClassPathResource(location + name + ".html");
        if (!resource.exists()) {
            throw new ViewNotFoundException("View '" + name + "' was not found at " + location + name + ".html");
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ViewNotFoundException("View '" + name + "' could not be read: " + e.getMessage(), e);
        }
    }

    /**
     * Thrown when a template is missing or unreadable.
     */
    public static class ViewNotFoundException extends RuntimeException {
        public ViewNotFoundException(String message) {
            super(message);
        }

        public ViewNotFoundException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
