package com.weave.routing.form;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed form content.
 *
 * @param fields field name to values, in submission order
 * @param files  uploaded files, in submission order
 */
public record Form(Map<String, List<String>> fields, List<UploadedFile> files) {

    public static final Form EMPTY = new Form(Map.of(), List.of());

    public Form {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        fields = Collections.unmodifiableMap(copy);
        files = files == null ? List.of() : List.copyOf(files);
    }

    /** First value of the named field. */
    public Optional<String> first(String name) {
        List<String> values = fields.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /** Submitted file names, in order. */
    public List<String> fileNames() {
        return files.stream().map(UploadedFile::fileName).toList();
    }
}
