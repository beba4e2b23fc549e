package com.weave.sampleapp.api;

import static com.weave.routing.Responders.setStatus;
import static com.weave.routing.Responders.text;

import com.weave.routing.Handler;
import com.weave.routing.RequestBody;
import com.weave.routing.form.CancellationToken;
import com.weave.routing.form.Form;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upload responders. Both answer with the submitted file names, each preceded by a newline.
 */
public final class UploadHandlers {

    private static final Logger log = LoggerFactory.getLogger(UploadHandlers.class);

    private static final Handler BAD_REQUEST = setStatus(400).then(text("Bad request"));

    private UploadHandlers() {
        // utility class
    }

    /**
     * Reads the whole form through the buffered reader. A body without form content answers
     * 400 "Bad request"; a form body that fails to parse reaches the error boundary.
     */
    public static Handler smallUpload() {
        return (exchange, next) -> {
            RequestBody body = exchange.request().body();
            if (!body.hasFormContentType()) {
                log.debug("Rejected upload to {}: no form content", exchange.request().path());
                return BAD_REQUEST.handle(exchange, next);
            }
            return fileNames(body.readForm()).handle(exchange, next);
        };
    }

    /**
     * Reads the form part by part through the streaming reader. Any read failure, including a
     * body without form content, reaches the error boundary.
     */
    public static Handler largeUpload() {
        return (exchange, next) -> fileNames(exchange.request().body().streamForm(CancellationToken.NONE))
                .handle(exchange, next);
    }

    /** {@code "" + "\n" + a + "\n" + b ...}; empty for no files. */
    public static String joinFileNames(List<String> fileNames) {
        String joined = "";
        for (String fileName : fileNames) {
            joined = joined + "\n" + fileName;
        }
        return joined;
    }

    private static Handler fileNames(Form form) {
        return text(joinFileNames(form.fileNames()));
    }
}
