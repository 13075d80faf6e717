package com.vitals.analytics.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs every API call and tags it with a request id, taken from {@code X-Request-ID}
 * when the caller sends one.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String REQUEST_ID_HEADER = "X-Request-ID";
  static final String RESPONSE_TIME_HEADER = "X-Response-Time-ms";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
      @NonNull FilterChain filterChain) throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }
    long startTime = System.currentTimeMillis();
    MDC.put("reqId", requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    log.info("req_id={} start method={} path={}", requestId, request.getMethod(), request.getRequestURI());
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("req_id={} {} {} failed: {}", requestId, request.getMethod(), request.getRequestURI(),
          ex.getMessage(), ex);
      throw ex;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      if (!response.isCommitted()) {
        response.setHeader(RESPONSE_TIME_HEADER, String.valueOf(duration));
      }
      log.info("req_id={} end status={} path={} duration_ms={}", requestId, response.getStatus(),
          request.getRequestURI(), duration);
      MDC.remove("reqId");
    }
  }
}
