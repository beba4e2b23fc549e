package com.weave.sampleapp.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.weave.routing.Exchange;
import com.weave.routing.Handler;
import com.weave.routing.HttpMethod;
import com.weave.routing.Next;
import com.weave.routing.Request;
import com.weave.routing.RequestBody;
import com.weave.routing.Response;
import com.weave.routing.form.Form;
import com.weave.routing.form.MalformedFormException;
import com.weave.routing.form.RequestBodies;
import com.weave.routing.form.UploadedFile;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("UploadHandlers")
class UploadHandlersTest {

    private static Response upload(Handler handler, RequestBody body) {
        Request request = Request.builder(HttpMethod.POST, "/upload").body(body).build();
        return handler.handle(Exchange.of(request), Next.END).toResponse().orElseThrow();
    }

    private static Form files(String... names) {
        return new Form(Map.of(), Arrays.stream(names)
                .map(name -> new UploadedFile("files", name, "text/plain", 1))
                .toList());
    }

    @Test
    @DisplayName("joins file names as a fold seeded with the empty string")
    void joinsFileNames() {
        assertThat(UploadHandlers.joinFileNames(List.of())).isEmpty();
        assertThat(UploadHandlers.joinFileNames(List.of("a.txt"))).isEqualTo("\na.txt");
        assertThat(UploadHandlers.joinFileNames(List.of("a.txt", "b.txt", "c.txt"))).isEqualTo("\na.txt\nb.txt\nc.txt");
    }

    @Test
    @DisplayName("small upload returns every file name")
    void smallUpload() {
        Response response = upload(UploadHandlers.smallUpload(), RequestBodies.multipart(files("a.txt", "b.txt")));

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.bodyAsString()).isEqualTo("\na.txt\nb.txt");
    }

    @Test
    @DisplayName("large upload returns every file name")
    void largeUpload() {
        Response response = upload(UploadHandlers.largeUpload(), RequestBodies.multipart(files("big.bin")));

        assertThat(response.bodyAsString()).isEqualTo("\nbig.bin");
    }

    @Test
    @DisplayName("small upload answers 400 Bad request for non-form content")
    void smallUploadBadRequest() {
        Response response = upload(UploadHandlers.smallUpload(), RequestBodies.json("{}"));

        assertThat(response.status()).isEqualTo(400);
        assertThat(response.bodyAsString()).isEqualTo("Bad request");
    }

    @Test
    @DisplayName("large upload lets a non-form body fail to the error boundary")
    void largeUploadFailsOnNonFormBody() {
        Handler handler = UploadHandlers.largeUpload();
        RequestBody body = RequestBodies.json("{}");

        assertThatThrownBy(() -> upload(handler, body))
                .isInstanceOf(MalformedFormException.class)
                .hasMessageContaining("Incorrect Content-Type");
    }
}
