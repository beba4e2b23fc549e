package com.weave.sampleapp.infrastructure.web;

import com.weave.observability.MetricFactory;
import com.weave.routing.Dispatch;
import com.weave.routing.HttpMethod;
import com.weave.routing.Request;
import com.weave.routing.Response;
import com.weave.routing.Router;
import com.weave.security.Principal;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriUtils;

/**
 * Hands every request not claimed by another mapping (actuator endpoints) to the {@link Router}.
 *
 * <p>Builds a host-independent {@link Request} from the servlet request, dispatches it and copies
 * the response back. Each dispatch is timed as {@value #TIMER_NAME}, tagged with method, status and
 * disposition.
 */
@RestController
public class RouterEndpoint {

    static final String TIMER_NAME = "weave.http.requests";

    private final Router router;
    private final MetricFactory metrics;

    public RouterEndpoint(Router router, MetricFactory metrics) {
        this.router = router;
        this.metrics = metrics;
    }

    @RequestMapping("/**")
    public void handle(HttpServletRequest servletRequest, HttpServletResponse servletResponse) throws IOException {
        Timer.Sample sample = Timer.start(metrics.registry());
        Request request = toRequest(servletRequest);
        Dispatch dispatch = router.dispatch(request);
        write(dispatch.response(), servletResponse);
        sample.stop(metrics.timer(TIMER_NAME, "Requests served by the router",
                "method", servletRequest.getMethod(),
                "status", String.valueOf(dispatch.response().status()),
                "disposition", dispatch.disposition().tagValue()));
    }

    static Request toRequest(HttpServletRequest servletRequest) {
        String rawPath = servletRequest.getRequestURI().substring(servletRequest.getContextPath().length());
        Request.Builder builder = Request.builder(
                        HttpMethod.fromString(servletRequest.getMethod()).orElse(null),
                        UriUtils.decode(rawPath.isEmpty() ? "/" : rawPath, StandardCharsets.UTF_8))
                .query(servletRequest.getQueryString())
                .secure(servletRequest.isSecure())
                .principal((Principal) servletRequest.getAttribute(CookieAuthenticationFilter.PRINCIPAL_ATTRIBUTE))
                .body(new ServletRequestBody(servletRequest));
        for (String name : Collections.list(servletRequest.getHeaderNames())) {
            for (String value : Collections.list(servletRequest.getHeaders(name))) {
                builder.header(name, value);
            }
        }
        Cookie[] cookies = servletRequest.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                builder.cookie(cookie.getName(), cookie.getValue());
            }
        }
        return builder.build();
    }

    private static void write(Response response, HttpServletResponse servletResponse) throws IOException {
        servletResponse.setStatus(response.status());
        for (Map.Entry<String, List<String>> header : response.headers().entrySet()) {
            for (String value : header.getValue()) {
                servletResponse.addHeader(header.getKey(), value);
            }
        }
        if (response.contentType() != null) {
            servletResponse.setContentType(response.contentType());
        }
        byte[] body = response.body();
        servletResponse.setContentLength(body.length);
        servletResponse.getOutputStream().write(body);
    }
}
