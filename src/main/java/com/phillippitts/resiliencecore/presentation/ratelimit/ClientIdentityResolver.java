package com.phillippitts.resiliencecore.presentation.ratelimit;

import com.phillippitts.resiliencecore.util.LogSanitizer;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Derives the admission-control identity of an HTTP client.
 *
 * <p>Identity is the socket peer address plus a coarse user-agent signature
 * ({@code ip:sig}). Forwarding headers such as X-Forwarded-For are ignored so a client cannot
 * pick a fresh identity by setting a header; deployments behind a proxy should let the
 * servlet container resolve the remote address.
 */
@Component
public class ClientIdentityResolver {

    static final int USER_AGENT_PREFIX = 100;
    static final int SIGNATURE_BUCKETS = 10_000;

    public String resolve(HttpServletRequest request) {
        String address = request.getRemoteAddr();
        if (address == null || address.isBlank()) {
            address = "unknown";
        }
        return address + ":" + userAgentSignature(request.getHeader("User-Agent"));
    }

    static int userAgentSignature(String userAgent) {
        String prefix = LogSanitizer.truncate(userAgent, USER_AGENT_PREFIX);
        return Math.floorMod(prefix.hashCode(), SIGNATURE_BUCKETS);
    }
}
