package com.phillippitts.peercall.config.logging;

import com.phillippitts.peercall.service.call.CallRecord;
import com.phillippitts.peercall.service.call.CallSessionManager;
import com.phillippitts.peercall.service.identity.IdentityReattachment;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Seeds Log4j2's ThreadContext for a REST call so the intent it hands to the call loop logs with
 * the same keys.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID; echoed in the response</li>
 *   <li>userId: the identity this installation is attached as, once known</li>
 *   <li>callId: the call in progress when the request arrived, if the relay has issued one</li>
 *   <li>method, uri</li>
 * </ul>
 *
 * <p>The call loop copies this context into each submitted task and replaces {@code callId}
 * while it handles an event for another call. The context is cleared after the request.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final ObjectProvider<IdentityReattachment> identity;
    private final ObjectProvider<CallSessionManager> calls;

    public MdcFilter(ObjectProvider<IdentityReattachment> identity, ObjectProvider<CallSessionManager> calls) {
        this.identity = identity;
        this.calls = calls;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = http.getHeader(REQUEST_ID_HEADER);
                if (requestId == null || requestId.isBlank()) {
                    requestId = UUID.randomUUID().toString();
                }
                ThreadContext.put("requestId", requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
                identity.ifAvailable(id -> id.knownUserId()
                        .ifPresent(userId -> ThreadContext.put("userId", userId)));
                calls.ifAvailable(manager -> manager.currentRecord()
                        .map(CallRecord::callId)
                        .ifPresent(callId -> ThreadContext.put("callId", callId)));
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }
}
