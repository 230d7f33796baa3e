package io.fieldledger.api;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Reads who is calling from {@code X-FL-Actor}, {@code X-FL-Device} and {@code X-FL-Session}
 * and exposes it to controllers as a {@link RequestActor} attribute and to logs through the MDC.
 */
@Component
@Order(5)
public class ActorContextFilter implements Filter {
    public static final String ATTRIBUTE = "fieldledger.actor";

    private final FieldLedgerProperties props;

    public ActorContextFilter(FieldLedgerProperties props) {
        this.props = props;
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain) throws IOException, ServletException {
        var r = (HttpServletRequest) req;
        var device = orDefault(r.getHeader("X-FL-Device"), props.deviceId());
        var actor = new RequestActor(
                orDefault(r.getHeader("X-FL-Actor"), "anonymous"),
                device,
                orDefault(r.getHeader("X-FL-Session"), device + ":default"));
        r.setAttribute(ATTRIBUTE, actor);
        MDC.put("actor", actor.actorId());
        MDC.put("device", actor.deviceId());
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove("actor");
            MDC.remove("device");
        }
    }

    private static String orDefault(String header, String fallback) {
        return header == null || header.isBlank() ? fallback : header.trim();
    }
}
