package com.weave.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.weave.routing.form.Form;
import com.weave.routing.form.MediaTypes;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds a request body to a model type.
 * <p>
 * JSON bodies ({@code application/json} or any {@code +json} type) are deserialized directly.
 * Form bodies bind the first value of each field to the property of the same name, ignoring
 * case, with Jackson's scalar coercion turning {@code "4"} into an int and ISO-8601 strings into
 * {@code java.time} values. Files in a multipart form are ignored.
 */
public final class ModelBinder {

    private ModelBinder() {
        // utility class
    }

    /**
     * @throws BindingException if the content type is unsupported or the body does not bind
     */
    public static <T> T bind(Request request, Class<T> type) {
        RequestBody body = request.body();
        String contentType = body.contentType().orElse("");
        if (MediaTypes.isJson(contentType)) {
            return bindJson(body.readAllBytes(), type);
        }
        if (MediaTypes.isForm(contentType)) {
            return bindForm(body.readForm(), type);
        }
        throw new BindingException("Cannot bind model from Content-Type '" + contentType + "'");
    }

    private static <T> T bindJson(byte[] json, Class<T> type) {
        try {
            return Json.mapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new BindingException(e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BindingException(e.getMessage(), e);
        }
    }

    private static <T> T bindForm(Form form, Class<T> type) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> field : form.fields().entrySet()) {
            if (!field.getValue().isEmpty()) {
                values.put(field.getKey(), field.getValue().get(0));
            }
        }
        try {
            return Json.mapper().convertValue(values, type);
        } catch (IllegalArgumentException e) {
            throw new BindingException(e.getMessage(), e);
        }
    }

    /**
     * Exception thrown when a request body cannot be bound.
     */
    public static class BindingException extends RuntimeException {
        public BindingException(String message) {
            super(message);
        }

        public BindingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
