package com.nomen.profile.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 内部トークンを検証し、経路ごとの主体を SecurityContext に設定する。
 *
 * <p>{@code /internal/**} は認証基盤からのイベント通知、{@code /me/**} と {@code /merge-requests:*}
 * は gateway が認証済み account id を {@code X-Account-Id} で転送してくる呼び出し元 API。
 */
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String USER_ROLE = "ROLE_USER";
  static final String EVENT_PRINCIPAL = "auth-events-internal";

  private final ProfileInternalApiProperties properties;

  public InternalApiAuthenticationFilter(ProfileInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !isEventRequest(request) && !isCallerRequest(request);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final boolean tokenValid = isValidInternalToken(request.getHeader(properties.headerName()));
    if (tokenValid && isCallerRequest(request) && forwardedAccountId(request) == null) {
      logger.warn(
          "caller request rejected: missing required header {} on path={}",
          ProfileInternalApiProperties.ACCOUNT_ID_HEADER,
          request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }
    final UsernamePasswordAuthenticationToken authentication =
        tokenValid ? resolveAuthentication(request) : null;
    if (authentication != null) {
      logger.debug(
          "internal authentication established for path={} authorities={}",
          request.getRequestURI(),
          authentication.getAuthorities());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "internal authentication not established for protected path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private boolean isEventRequest(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return "POST".equals(request.getMethod()) && uri != null && uri.startsWith("/internal/");
  }

  private boolean isCallerRequest(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    if (uri == null) {
      return false;
    }
    return uri.startsWith("/me/") || uri.startsWith("/merge-requests:");
  }

  private UsernamePasswordAuthenticationToken resolveAuthentication(HttpServletRequest request) {
    if (isEventRequest(request)) {
      return new UsernamePasswordAuthenticationToken(
          EVENT_PRINCIPAL, "N/A", List.of(new SimpleGrantedAuthority(INTERNAL_ROLE)));
    }
    final String accountId = forwardedAccountId(request);
    if (accountId == null) {
      return null;
    }
    return new UsernamePasswordAuthenticationToken(
        accountId,
        "N/A",
        List.of(new SimpleGrantedAuthority(INTERNAL_ROLE), new SimpleGrantedAuthority(USER_ROLE)));
  }

  private String forwardedAccountId(HttpServletRequest request) {
    final String value = request.getHeader(ProfileInternalApiProperties.ACCOUNT_ID_HEADER);
    return value == null || value.isBlank() ? null : value;
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && actualToken.equals(properties.token())
        && !properties.token().isBlank();
  }
}
