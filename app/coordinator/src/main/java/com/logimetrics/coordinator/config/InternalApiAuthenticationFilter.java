package com.logimetrics.coordinator.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Trusts the identity the API gateway forwards on admin and push subscription requests. The
 * forwarded user id becomes the principal name; an ADMIN role in the forwarded roles maps to
 * {@code ROLE_ADMIN}.
 */
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String ADMIN_ROLE = "ROLE_ADMIN";

  private final InternalApiProperties properties;

  public InternalApiAuthenticationFilter(InternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !isProtectedPath(request.getRequestURI());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final UsernamePasswordAuthenticationToken authentication = resolveAuthentication(request);
    if (authentication != null) {
      logger.debug(
          "internal authentication established for path={} authorities={}",
          request.getRequestURI(),
          authentication.getAuthorities());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "internal authentication not established for protected path={}",
          request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  static boolean isProtectedPath(String uri) {
    return uri != null && (uri.startsWith("/admin/") || uri.startsWith("/push/"));
  }

  private UsernamePasswordAuthenticationToken resolveAuthentication(HttpServletRequest request) {
    if (!properties.isValidToken(request.getHeader(properties.headerName()))) {
      return null;
    }
    final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
    if (forwardedUserId == null || forwardedUserId.isBlank()) {
      return null;
    }
    return new UsernamePasswordAuthenticationToken(
        forwardedUserId.trim(),
        "N/A",
        buildAuthorities(request.getHeader(properties.userRolesHeaderName())));
  }

  private List<SimpleGrantedAuthority> buildAuthorities(String forwardedRoles) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(INTERNAL_ROLE));
    if (forwardedRoles == null || forwardedRoles.isBlank()) {
      return authorities;
    }
    for (String role : forwardedRoles.split(",")) {
      final String normalized = role == null ? "" : role.trim();
      if ("ADMIN".equalsIgnoreCase(normalized) || ADMIN_ROLE.equals(normalized)) {
        authorities.add(new SimpleGrantedAuthority(ADMIN_ROLE));
        break;
      }
    }
    return authorities;
  }
}
