package com.weave.sampleapp.infrastructure.web;

import com.weave.routing.RequestBody;
import com.weave.routing.form.CancellationToken;
import com.weave.routing.form.Form;
import com.weave.routing.form.MalformedFormException;
import com.weave.routing.form.MediaTypes;
import com.weave.routing.form.UploadedFile;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.Part;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StreamUtils;
import org.springframework.web.multipart.MultipartException;

/**
 * {@link RequestBody} over a servlet request.
 *
 * <p>Form fields come from the container's parameter map. Multipart files come from
 * {@link HttpServletRequest#getParts()}: {@link #readForm()} lets the container buffer them,
 * {@link #streamForm} drains each part in {@value #CHUNK_SIZE}-byte chunks and checks the
 * cancellation token between chunks. Multipart resolution must be lazy for the parts to be
 * unread when the router runs.
 */
public class ServletRequestBody implements RequestBody {

    static final int CHUNK_SIZE = 8 * 1024;

    private final HttpServletRequest request;
    private byte[] bytes;

    public ServletRequestBody(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public Optional<String> contentType() {
        return Optional.ofNullable(request.getContentType());
    }

    @Override
    public byte[] readAllBytes() {
        if (bytes == null) {
            try {
                bytes = StreamUtils.copyToByteArray(request.getInputStream());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read request body", e);
            }
        }
        return bytes.clone();
    }

    @Override
    public Form readForm() {
        requireFormContent();
        if (!MediaTypes.isMultipart(request.getContentType())) {
            return new Form(fields(), List.of());
        }
        List<UploadedFile> files = new ArrayList<>();
        for (Part part : parts()) {
            if (part.getSubmittedFileName() != null) {
                files.add(new UploadedFile(part.getName(), part.getSubmittedFileName(), part.getContentType(),
                        part.getSize()));
            }
        }
        return new Form(fields(), files);
    }

    @Override
    public Form streamForm(CancellationToken token) {
        token.throwIfCancellationRequested();
        requireFormContent();
        if (!MediaTypes.isMultipart(request.getContentType())) {
            return new Form(fields(), List.of());
        }
        List<UploadedFile> files = new ArrayList<>();
        for (Part part : parts()) {
            token.throwIfCancellationRequested();
            if (part.getSubmittedFileName() != null) {
                long length = drain(part, token);
                files.add(new UploadedFile(part.getName(), part.getSubmittedFileName(), part.getContentType(), length));
            }
        }
        return new Form(fields(), files);
    }

    private void requireFormContent() {
        if (!hasFormContentType()) {
            throw new MalformedFormException("Incorrect Content-Type: " + contentType().orElse(""));
        }
    }

    private Map<String, List<String>> fields() {
        Map<String, List<String>> fields = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> fields.put(name, Arrays.asList(values)));
        return fields;
    }

    private List<Part> parts() {
        try {
            return new ArrayList<>(request.getParts());
        } catch (IOException | ServletException | MultipartException | IllegalStateException e) {
            throw new MalformedFormException("Failed to parse multipart body: " + e.getMessage(), e);
        }
    }

    private static long drain(Part part, CancellationToken token) {
        byte[] buffer = new byte[CHUNK_SIZE];
        long total = 0;
        try (InputStream in = part.getInputStream()) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
                token.throwIfCancellationRequested();
            }
        } catch (IOException e) {
            throw new MalformedFormException("Failed to read part '" + part.getName() + "': " + e.getMessage(), e);
        }
        return total;
    }
}
