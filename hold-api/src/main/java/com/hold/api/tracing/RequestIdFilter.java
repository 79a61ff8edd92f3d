package com.hold.api.tracing;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags each control API call and node hook call with an id that shows up in the log
 * lines written on the request thread.
 * A caller-supplied {@value #HDR_REQUEST_ID} (or X-Correlation-Id) is kept, otherwise a
 * random UUID is used; the id is returned in the {@value #HDR_REQUEST_ID} response header.
 * Async hook completions run on other threads and log without it.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String HDR_REQUEST_ID = "X-Request-Id";
  public static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String reqId = firstNonBlank(request.getHeader(HDR_REQUEST_ID), request.getHeader("X-Correlation-Id"));
    if (reqId == null) reqId = UUID.randomUUID().toString();

    MDC.put(MDC_REQUEST_ID, reqId);
    response.setHeader(HDR_REQUEST_ID, reqId);

    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  private static String firstNonBlank(String a, String b) {
    if (a != null && !a.isBlank()) return a.trim();
    if (b != null && !b.isBlank()) return b.trim();
    return null;
  }
}
