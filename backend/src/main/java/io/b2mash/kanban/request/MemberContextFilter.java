package io.b2mash.kanban.request;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller's member id from the {@code X-Member-Id} header and tags the logging MDC with
 * a request id. A malformed header is ignored and the request proceeds unattributed.
 */
@Component
public class MemberContextFilter extends OncePerRequestFilter {

  public static final String MEMBER_ID_HEADER = "X-Member-Id";

  private static final Logger log = LoggerFactory.getLogger(MemberContextFilter.class);

  private static final String MDC_MEMBER_ID = "memberId";
  private static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      UUID memberId = parseMemberId(request.getHeader(MEMBER_ID_HEADER));
      if (memberId != null) {
        RequestScopes.bindMemberId(memberId);
        MDC.put(MDC_MEMBER_ID, memberId.toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      RequestScopes.clear();
      MDC.remove(MDC_MEMBER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  private static UUID parseMemberId(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(header.trim());
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed {} header: {}", MEMBER_ID_HEADER, header);
      return null;
    }
  }
}
