package com.weave.sampleapp.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.weave.observability.CorrelationContext;
import com.weave.observability.CorrelationContextHolder;
import com.weave.security.Principal;
import com.weave.security.Session;
import com.weave.security.SessionOptions;
import com.weave.security.SessionStore;
import com.weave.security.testing.TestPrincipalFactory;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.Cookie;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CookieAuthenticationFilter")
class CookieAuthenticationFilterTest {

    private static final Instant NOW = Instant.parse("2026-10-17T10:00:00Z");

    private final SessionStore sessionStore = mock(SessionStore.class);
    private final SessionOptions options = SessionOptions.defaults();
    private final CookieAuthenticationFilter filter =
            new CookieAuthenticationFilter(sessionStore, options, Clock.fixed(NOW, ZoneOffset.UTC));
    private final Principal john = TestPrincipalFactory.createWithRoles("John", "Admin");

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private static MockHttpServletRequest withCookie(String value) {
        var request = new MockHttpServletRequest();
        request.setCookies(new Cookie(".Weave.Cookie", value));
        return request;
    }

    @Test
    @DisplayName("passes anonymous requests through without touching the store")
    void anonymous() throws Exception {
        var request = new MockHttpServletRequest();

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(request.getAttribute(CookieAuthenticationFilter.PRINCIPAL_ATTRIBUTE)).isNull();
        verify(sessionStore, never()).resolve(anyString(), any());
    }

    @Test
    @DisplayName("binds the principal of a live session and tags the correlation context")
    void liveSession() throws Exception {
        when(sessionStore.resolve("token-1", NOW))
                .thenReturn(Optional.of(new Session("token-1", john, NOW, NOW.plus(Duration.ofDays(7)), false)));
        CorrelationContextHolder.set(CorrelationContext.of("corr-1"));
        var request = withCookie("token-1");
        var response = new MockHttpServletResponse();
        var userDuringChain = new AtomicReference<String>();
        FilterChain chain = (req, resp) ->
                userDuringChain.set(CorrelationContextHolder.get().map(CorrelationContext::userId).orElse(null));

        filter.doFilter(request, response, chain);

        assertThat(request.getAttribute(CookieAuthenticationFilter.PRINCIPAL_ATTRIBUTE)).isSameAs(john);
        assertThat(userDuringChain.get()).isEqualTo("John");
        assertThat(response.getHeader("Set-Cookie")).isNull();
    }

    @Test
    @DisplayName("re-sends the cookie when the session was renewed")
    void renewedSession() throws Exception {
        when(sessionStore.resolve("token-2", NOW))
                .thenReturn(Optional.of(new Session("token-2", john, NOW, NOW.plus(Duration.ofDays(7)), true)));
        var response = new MockHttpServletResponse();

        filter.doFilter(withCookie("token-2"), response, (req, resp) -> {});

        assertThat(response.getHeader("Set-Cookie"))
                .startsWith(".Weave.Cookie=token-2")
                .contains("Max-Age=604800");
    }

    @Test
    @DisplayName("leaves the request anonymous for an unknown or expired session")
    void unknownSession() throws Exception {
        when(sessionStore.resolve("stale", NOW)).thenReturn(Optional.empty());
        var request = withCookie("stale");

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(request.getAttribute(CookieAuthenticationFilter.PRINCIPAL_ATTRIBUTE)).isNull();
    }
}
