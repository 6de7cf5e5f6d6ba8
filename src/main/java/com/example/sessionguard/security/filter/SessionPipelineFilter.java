package com.example.sessionguard.security.filter;

import com.example.sessionguard.domain.entity.PipelineResult;
import com.example.sessionguard.domain.entity.RouteDecision;
import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.service.RequestPipeline;
import com.example.sessionguard.util.CookieUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Edge interceptor: runs the {@link RequestPipeline} for every request and turns its result
 * into an HTTP response.
 * <p>
 * The cookie update is written before the decision is acted on, so redirects carry a session
 * refreshed during this request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionPipelineFilter extends OncePerRequestFilter {

  public static final String PIPELINE_RESULT_ATTRIBUTE = SessionPipelineFilter.class.getName() + ".RESULT";
  private static final String ROLE_USER = "ROLE_USER";

  private final RequestPipeline requestPipeline;
  private final ApplicationProperties properties;
  private final ObjectMapper objectMapper;
  private final UrlPathHelper urlPathHelper = new UrlPathHelper();

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    ApplicationProperties.SessionProperties.CookieProperties cookie = properties.session().cookie();
    Optional<String> sessionValue = CookieUtil.getSessionValue(request, cookie);
    String path = urlPathHelper.getPathWithinApplication(request);
    String returnTo = request.getQueryString() != null ? path + "?" + request.getQueryString() : path;

    PipelineResult result;
    try {
      result = requestPipeline.process(sessionValue.orElse(null), path, returnTo);
    } catch (RuntimeException e) {
      // Fall back to an unauthenticated pass; the guard still runs.
      log.error("Session pipeline failed for {}, treating request as unauthenticated", path, e);
      result = requestPipeline.process(null, path, returnTo);
      if (sessionValue.isPresent()) {
        CookieUtil.clearSessionCookie(response, cookie);
      }
    }

    CookieUtil.apply(response, result.transportUpdate(), cookie);
    request.setAttribute(PIPELINE_RESULT_ATTRIBUTE, result);

    RouteDecision decision = result.decision();
    switch (decision.type()) {
      case ALLOW -> {
        result.currentSession().ifPresent(SessionPipelineFilter::authenticate);
        filterChain.doFilter(request, response);
      }
      case REDIRECT -> sendRedirect(request, response, decision.location());
      case DENY -> sendDenial(response, decision.status(), path);
    }
  }

  private static void authenticate(SessionArtifact artifact) {
    UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
        artifact.subjectId(), null, List.of(new SimpleGrantedAuthority(ROLE_USER)));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    log.trace("Authenticated subject {} from session cookie", artifact.subjectId());
  }

  private void sendRedirect(HttpServletRequest request, HttpServletResponse response, String location) {
    String target = location.startsWith("/") ? request.getContextPath() + location : location;
    response.setStatus(HttpStatus.FOUND.value());
    response.setHeader(HttpHeaders.LOCATION, target);
    response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate");
    log.debug("Redirecting {} to {}", request.getRequestURI(), target);
  }

  private void sendDenial(HttpServletResponse response, int status, String path) throws IOException {
    HttpStatus httpStatus = HttpStatus.valueOf(status);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now().toString());
    body.put("status", status);
    body.put("error", httpStatus == HttpStatus.UNAUTHORIZED ? "authentication_required" : "access_denied");
    body.put("message", httpStatus.getReasonPhrase());
    body.put("path", path);

    response.setStatus(status);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getWriter(), body);
  }
}
