package com.example.sessionguard.security;

import com.example.sessionguard.domain.entity.PipelineResult;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.security.filter.SessionPipelineFilter;
import com.example.sessionguard.service.SessionStore;
import com.example.sessionguard.service.SessionStoreFactory;
import com.example.sessionguard.util.CookieUtil;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Read-only session access for request handlers.
 * <p>
 * Prefers the artifact the edge interceptor decided on for this request, so handlers see a
 * session refreshed earlier in the same request. Falls back to decoding the inbound cookie
 * when the interceptor did not run. Never refreshes.
 */
@Component
@RequiredArgsConstructor
public class RenderSessionAccessor {

  private final SessionStoreFactory storeFactory;
  private final ApplicationProperties properties;

  public SessionStore current(HttpServletRequest request) {
    Object attribute = request.getAttribute(SessionPipelineFilter.PIPELINE_RESULT_ATTRIBUTE);
    if (attribute instanceof PipelineResult) {
      return storeFactory.serverRenderView(((PipelineResult) attribute).session());
    }
    String value = CookieUtil.getSessionValue(request, properties.session().cookie()).orElse(null);
    return storeFactory.openServerRender(value);
  }
}
