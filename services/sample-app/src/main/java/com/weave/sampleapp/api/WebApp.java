package com.weave.sampleapp.api;

import static com.weave.routing.Guards.get;
import static com.weave.routing.Guards.path;
import static com.weave.routing.Guards.pathTemplate;
import static com.weave.routing.Guards.post;
import static com.weave.routing.Guards.requiresAuthentication;
import static com.weave.routing.Guards.requiresRole;
import static com.weave.routing.Handlers.choose;
import static com.weave.routing.Responders.setStatus;
import static com.weave.routing.Responders.text;

import com.weave.routing.Handler;
import com.weave.routing.Handlers;
import com.weave.routing.Router;
import com.weave.sampleapp.config.SampleAppProperties;
import com.weave.sampleapp.domain.Person;
import com.weave.sampleapp.views.ViewRenderer;
import com.weave.security.SessionStore;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * The sample app's route table.
 *
 * <p>Route order matters: the first pipeline that does not fall through answers. The start time
 * served by {@code /once} is captured when the table is built.
 */
public class WebApp {

    public static final String ADMIN_ROLE = "Admin";

    private final Clock clock;
    private final String startedAt;
    private final AuthHandlers auth;
    private final ViewHandlers views;
    private final Router router;

    public WebApp(SampleAppProperties properties, SessionStore sessionStore, Clock clock, ViewRenderer renderer) {
        this.clock = clock;
        this.startedAt = timestamp(clock);
        this.auth = new AuthHandlers(sessionStore, properties.sessionOptions(), clock, properties.issuer());
        this.views = new ViewHandlers(renderer);
        this.router = Router.builder()
                .route(get().then(getRoutes()))
                .route(post().then(postRoutes()))
                .route(path("/car").then(CarHandlers.echoCar()))
                .build();
    }

    public Router router() {
        return router;
    }

    /** Timestamp served by {@code /once}. */
    public String startedAt() {
        return startedAt;
    }

    private Handler getRoutes() {
        Handler accessDenied = setStatus(401).then(text("Access Denied"));
        Handler mustBeUser = requiresAuthentication(accessDenied);
        Handler mustBeAdmin = mustBeUser.then(requiresRole(ADMIN_ROLE, accessDenied));

        return choose(
                path("/").then(text("index")),
                path("/ping").then(text("pong")),
                path("/error").then((exchange, next) -> {
                    throw new IllegalStateException("Something went wrong!");
                }),
                path("/login").then(auth.login()).then(text("Successfully logged in")),
                path("/logout").then(auth.logout()).then(text("Successfully logged out.")),
                path("/user").then(mustBeUser).then(auth.showUser()),
                pathTemplate("/user/{id:int}", params -> mustBeAdmin.then(text("User ID: " + params.getInt("id")))),
                path("/razor").then(views.view("Person", new Person("Razor"))),
                path("/razorHello").then(views.view("Hello")),
                path("/fileupload").then(views.view("FileUpload")),
                path("/person").then(views.person(new Person("Html Node"))),
                path("/once").then(text(startedAt)),
                path("/everytime").then(Handlers.deferred(request -> text(timestamp(clock)))));
    }

    private Handler postRoutes() {
        return choose(
                path("/small-upload").then(UploadHandlers.smallUpload()),
                path("/large-upload").then(UploadHandlers.largeUpload()));
    }

    private static String timestamp(Clock clock) {
        return OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
