package com.weave.sampleapp.config;

import com.weave.observability.MetricFactory;
import com.weave.routing.Router;
import com.weave.sampleapp.api.WebApp;
import com.weave.sampleapp.views.ViewRenderer;
import com.weave.security.InMemorySessionStore;
import com.weave.security.SessionOptions;
import com.weave.security.SessionStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the route table and its collaborators.
 *
 * <p>{@code /once}, {@code /everytime} and session expiry all read time through the {@link Clock}
 * bean.
 */
@Configuration
public class WebConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SessionOptions sessionOptions(SampleAppProperties properties) {
        return properties.sessionOptions();
    }

    @Bean
    public SessionStore sessionStore(SessionOptions sessionOptions) {
        return new InMemorySessionStore(sessionOptions);
    }

    @Bean
    public ViewRenderer viewRenderer() {
        return new ViewRenderer();
    }

    @Bean
    public WebApp webApp(
            SampleAppProperties properties, SessionStore sessionStore, Clock clock, ViewRenderer viewRenderer) {
        return new WebApp(properties, sessionStore, clock, viewRenderer);
    }

    @Bean
    public Router router(WebApp webApp) {
        return webApp.router();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, SampleAppProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }
}
