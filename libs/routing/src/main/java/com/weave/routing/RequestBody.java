package com.weave.routing;

import com.weave.routing.form.CancellationToken;
import com.weave.routing.form.Form;
import com.weave.routing.form.MalformedFormException;
import com.weave.routing.form.MediaTypes;
import java.util.Optional;

/**
 * Body of a {@link Request}.
 * <p>
 * Reading is deferred until a responder asks for it, so route matching never touches the body.
 * Implementations read at most once; later reads return the cached result where the medium
 * allows it.
 */
public interface RequestBody {

    /** The {@code Content-Type} header, if present. */
    Optional<String> contentType();

    /**
     * Whether the body is {@code application/x-www-form-urlencoded} or
     * {@code multipart/form-data}.
     */
    default boolean hasFormContentType() {
        return contentType().map(MediaTypes::isForm).orElse(false);
    }

    /**
     * Reads the whole body into memory.
     *
     * @throws java.io.UncheckedIOException if the body cannot be read
     */
    byte[] readAllBytes();

    /**
     * Reads the form, buffering file parts as the host sees fit.
     *
     * @throws MalformedFormException if the body is not form content or cannot be parsed
     */
    Form readForm();

    /**
     * Reads the form part by part, draining each file in chunks and checking {@code token}
     * between chunks. File contents are discarded; only names, types and sizes are kept.
     *
     * @throws MalformedFormException if the body is not form content or cannot be parsed
     * @throws java.util.concurrent.CancellationException if {@code token} is cancelled mid-read
     */
    Form streamForm(CancellationToken token);
}
