package com.weave.routing;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled path template such as {@code /user/{id:int}/files/{name}}.
 * <p>
 * Each {@code /}-separated segment is either a literal, matched exactly, or a placeholder
 * {@code {name}} / {@code {name:type}}. Supported types are {@code int}, {@code long},
 * {@code double}, {@code bool}, {@code string} (the default) and {@code uuid}. A path matches
 * only if it has the same number of segments and every placeholder segment converts to its type.
 * Numeric segments take ASCII digits with an optional leading minus ({@code double} also an
 * optional fraction), so {@code +42} or {@code 1e3} do not match.
 */
public final class PathTemplate {

    private static final Pattern INTEGRAL = Pattern.compile("-?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)(?::([a-z]+))?}");

    private final String template;
    private final List<Segment> segments;

    private PathTemplate(String template, List<Segment> segments) {
        this.template = template;
        this.segments = List.copyOf(segments);
    }

    /**
     * @throws InvalidTemplateException for unknown types, duplicate names or stray braces
     */
    public static PathTemplate compile(String template) {
        if (template == null || !template.startsWith("/")) {
            throw new InvalidTemplateException("Template must start with '/': " + template);
        }
        List<Segment> segments = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (String part : split(template)) {
            Matcher matcher = PLACEHOLDER.matcher(part);
            if (matcher.matches()) {
                String name = matcher.group(1);
                String typeName = matcher.group(2) == null ? "string" : matcher.group(2);
                ParameterType type = ParameterType.fromName(typeName)
                        .orElseThrow(() -> new InvalidTemplateException(
                                "Unknown parameter type '" + typeName + "' in " + template));
                if (!names.add(name)) {
                    throw new InvalidTemplateException("Duplicate parameter '" + name + "' in " + template);
                }
                segments.add(new Segment(null, name, type));
            } else if (part.indexOf('{') >= 0 || part.indexOf('}') >= 0) {
                throw new InvalidTemplateException("Malformed segment '" + part + "' in " + template);
            } else {
                segments.add(new Segment(part, null, null));
            }
        }
        return new PathTemplate(template, segments);
    }

    /** Extracts typed parameters from {@code path}, or empty if it does not match. */
    public Optional<PathParameters> match(String path) {
        if (path == null || !path.startsWith("/")) {
            return Optional.empty();
        }
        String[] parts = split(path);
        if (parts.length != segments.size()) {
            return Optional.empty();
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < parts.length; i++) {
            Segment segment = segments.get(i);
            if (segment.literal() != null) {
                if (!segment.literal().equals(parts[i])) {
                    return Optional.empty();
                }
                continue;
            }
            Optional<Object> value = segment.type().convert(parts[i]);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            values.put(segment.name(), value.get());
        }
        return Optional.of(new PathParameters(values));
    }

    public String template() {
        return template;
    }

    @Override
    public String toString() {
        return template;
    }

    private static String[] split(String path) {
        // "/a/b" -> ["a", "b"]; "/" -> [""]
        return path.substring(1).split("/", -1);
    }

    // ASCII digits only; the JDK parsers also take '+', Unicode digits, NaN and hex floats
    private static String requireFormat(Pattern format, String value) {
        if (!format.matcher(value).matches()) {
            throw new IllegalArgumentException("Unexpected number format: " + value);
        }
        return value;
    }

    private record Segment(String literal, String name, ParameterType type) {
    }

    private enum ParameterType {
        INT(value -> Integer.valueOf(requireFormat(INTEGRAL, value))),
        LONG(value -> Long.valueOf(requireFormat(INTEGRAL, value))),
        DOUBLE(value -> Double.valueOf(requireFormat(DECIMAL, value))),
        BOOL(value -> {
            if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
                return Boolean.valueOf(value);
            }
            throw new IllegalArgumentException("Not a boolean: " + value);
        }),
        STRING(value -> value),
        UUID(java.util.UUID::fromString);

        private final Function<String, Object> parser;

        ParameterType(Function<String, Object> parser) {
            this.parser = parser;
        }

        static Optional<ParameterType> fromName(String name) {
            for (ParameterType type : values()) {
                if (type.name().toLowerCase(Locale.ROOT).equals(name)) {
                    return Optional.of(type);
                }
            }
            return Optional.empty();
        }

        Optional<Object> convert(String raw) {
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(parser.apply(raw));
            } catch (IllegalArgumentException e) {
                // NumberFormatException included: overflow and junk both mean "no match"
                return Optional.empty();
            }
        }
    }

    /**
     * Thrown when a template cannot be compiled.
     */
    public static class InvalidTemplateException extends IllegalArgumentException {
        public InvalidTemplateException(String message) {
            super(message);
        }
    }
}
