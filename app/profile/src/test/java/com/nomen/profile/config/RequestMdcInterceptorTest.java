package com.nomen.profile.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
    SecurityContextHolder.clearContext();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    SecurityContextHolder.getContext()
        .setAuthentication(
            new UsernamePasswordAuthenticationToken(
                "account-1", "N/A", List.of(new SimpleGrantedAuthority("ROLE_USER"))));

    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/me/profile");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    try {
      interceptor.preHandle(request, response, new Object());
    } catch (Exception ex) {
      fail("preHandle should not throw", ex);
    }

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("GET");
    assertThat(MDC.get("http_path")).isEqualTo("/me/profile");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("account_id")).isEqualTo("account-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("account_id")).isNull();
  }

  @Test
  void generatesRequestIdAndSkipsAccountForInternalEvents() {
    SecurityContextHolder.getContext()
        .setAuthentication(
            new UsernamePasswordAuthenticationToken(
                "auth-events-internal",
                "N/A",
                List.of(new SimpleGrantedAuthority("ROLE_INTERNAL"))));
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/internal/identities:sync");
    request.setRemoteAddr("192.168.0.5");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("client_ip")).isEqualTo("192.168.0.5");
    assertThat(MDC.get("account_id")).isNull();
  }
}
