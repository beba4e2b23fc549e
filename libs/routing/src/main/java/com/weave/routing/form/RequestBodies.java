package com.weave.routing.form;

import com.weave.routing.RequestBody;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * In-memory {@link RequestBody} implementations, for requests without a body and for tests.
 */
public final class RequestBodies {

    private static final RequestBody EMPTY = new InMemoryRequestBody(null, new byte[0], null);

    private RequestBodies() {
        // utility class
    }

    /** A body with no content type and no bytes. */
    public static RequestBody empty() {
        return EMPTY;
    }

    /**
     * Raw bytes. URL-encoded content is parsed on {@link RequestBody#readForm()}; any other
     * content type fails form reads.
     */
    public static RequestBody of(String contentType, byte[] bytes) {
        return new InMemoryRequestBody(contentType, bytes, null);
    }

    /** A JSON body. */
    public static RequestBody json(String json) {
        return of(MediaTypes.APPLICATION_JSON, json.getBytes(StandardCharsets.UTF_8));
    }

    /** A URL-encoded form with single-valued fields. */
    public static RequestBody urlEncoded(Map<String, String> fields) {
        StringJoiner joiner = new StringJoiner("&");
        fields.forEach((name, value) -> joiner.add(
                URLEncoder.encode(name, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return of(MediaTypes.FORM_URLENCODED, joiner.toString().getBytes(StandardCharsets.UTF_8));
    }

    /** A multipart body that has already been parsed into {@code form}. */
    public static RequestBody multipart(Form form) {
        return new InMemoryRequestBody(MediaTypes.MULTIPART_FORM_DATA + "; boundary=weave", new byte[0], form);
    }

    /**
     * Parses {@code application/x-www-form-urlencoded} content.
     *
     * @throws MalformedFormException if a name or value is not valid percent-encoding
     */
    public static Form parseUrlEncoded(String content) {
        Map<String, List<String>> fields = new LinkedHashMap<>();
        if (content.isEmpty()) {
            return Form.EMPTY;
        }
        try {
            for (String pair : content.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String name = URLDecoder.decode(eq >= 0 ? pair.substring(0, eq) : pair, StandardCharsets.UTF_8);
                String value = eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
                fields.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
            }
        } catch (IllegalArgumentException e) {
            throw new MalformedFormException("Malformed form content: " + e.getMessage(), e);
        }
        return new Form(fields, List.of());
    }

    private static final class InMemoryRequestBody implements RequestBody {

        private final String contentType;
        private final byte[] bytes;
        private final Form form;

        InMemoryRequestBody(String contentType, byte[] bytes, Form form) {
            this.contentType = contentType;
            this.bytes = bytes == null ? new byte[0] : bytes.clone();
            this.form = form;
        }

        @Override
        public Optional<String> contentType() {
            return Optional.ofNullable(contentType);
        }

        @Override
        public byte[] readAllBytes() {
            return bytes.clone();
        }

        @Override
        public Form readForm() {
            if (!hasFormContentType()) {
                throw new MalformedFormException("Incorrect Content-Type: " + Optional.ofNullable(contentType).orElse(""));
            }
            if (form != null) {
                return form;
            }
            if (MediaTypes.isMultipart(contentType)) {
                throw new MalformedFormException("Missing multipart content");
            }
            return parseUrlEncoded(new String(bytes, StandardCharsets.UTF_8));
        }

        @Override
        public Form streamForm(CancellationToken token) {
            token.throwIfCancellationRequested();
            Form parsed = readForm();
            for (UploadedFile ignored : parsed.files()) {
                token.throwIfCancellationRequested();
            }
            return parsed;
        }
    }
}
