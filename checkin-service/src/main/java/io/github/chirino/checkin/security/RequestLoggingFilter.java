package io.github.chirino.checkin.security;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.ext.Provider;
import java.io.IOException;
import org.jboss.logging.Logger;

@Provider
@Priority(Priorities.AUTHENTICATION - 1) // Run before the admin key check
public class RequestLoggingFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(RequestLoggingFilter.class);

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        String adminKey = requestContext.getHeaderString(AdminKeyRequestFilter.HEADER_NAME);
        LOG.debugf(
                "Incoming request: %s %s, admin key present: %b",
                requestContext.getMethod(),
                requestContext.getUriInfo().getPath(),
                adminKey != null && !adminKey.isEmpty());
    }
}
