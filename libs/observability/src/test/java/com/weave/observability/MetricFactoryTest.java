package com.weave.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link MetricFactory}: service tag and counter/timer creation. */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "sample-app");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }

        @Test
        @DisplayName("should expose registry and service name")
        void shouldExposeRegistryAndServiceName() {
            assertThat(factory.registry()).isSameAs(registry);
            assertThat(factory.serviceName()).isEqualTo("sample-app");
        }
    }

    @Test
    @DisplayName("counter carries service tag and extra tags")
    void counterCarriesTags() {
        Counter counter = factory.counter("weave.sessions.issued", "Sessions issued", "scheme", "Cookie");

        counter.increment();
        counter.increment();

        assertThat(counter.count()).isEqualTo(2.0);
        assertThat(counter.getId().getTag("service")).isEqualTo("sample-app");
        assertThat(counter.getId().getTag("scheme")).isEqualTo("Cookie");
    }

    @Test
    @DisplayName("timer carries service tag and records durations")
    void timerRecords() {
        Timer timer = factory.timer("weave.http.requests", "Routed requests", "status", "200");

        timer.record(Duration.ofMillis(150));
        timer.record(Duration.ofMillis(250));

        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(400.0);
        assertThat(timer.getId().getTag("service")).isEqualTo("sample-app");
        assertThat(timer.getId().getTag("status")).isEqualTo("200");
    }

    @Test
    @DisplayName("same name and tags resolve to the same meter")
    void sameTagsSameMeter() {
        Timer first = factory.timer("weave.http.requests", "Routed requests", "status", "404");
        Timer second = factory.timer("weave.http.requests", "Routed requests", "status", "404");

        first.record(Duration.ofMillis(1));
        second.record(Duration.ofMillis(1));

        assertThat(first).isSameAs(second);
        assertThat(registry.get("weave.http.requests").tag("status", "404").timer().count())
                .isEqualTo(2);
    }
}
