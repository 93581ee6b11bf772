package io.github.chirino.checkin.security;

import io.github.chirino.checkin.api.dto.ErrorResponse;
import io.smallrye.config.SmallRyeConfig;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import java.io.IOException;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

@Provider
@Priority(Priorities.AUTHENTICATION + 10)
@ApplicationScoped
public class AdminKeyRequestFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(AdminKeyRequestFilter.class);
    public static final String HEADER_NAME = "X-Admin-Key";

    private final List<byte[]> validKeys;

    @Context ResourceInfo resourceInfo;

    public AdminKeyRequestFilter() {
        this(
                ((SmallRyeConfig) ConfigProvider.getConfig())
                        .getOptionalValues("checkin.admin.keys", String.class)
                        .orElse(Collections.emptyList()));
    }

    AdminKeyRequestFilter(Collection<String> keys) {
        List<byte[]> normalized = new ArrayList<>();
        for (String key : keys) {
            if (key != null) {
                String trimmed = key.trim();
                if (!trimmed.isEmpty()) {
                    normalized.add(trimmed.getBytes(StandardCharsets.UTF_8));
                }
            }
        }
        this.validKeys = List.copyOf(normalized);
        if (validKeys.isEmpty()) {
            LOG.info("No admin keys configured (checkin.admin.keys); the admin API is disabled.");
        } else {
            LOG.infof("Configured %d admin key(s).", validKeys.size());
        }
    }

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        if (!isAdminKeyRequired()) {
            return;
        }
        if (validKeys.isEmpty()) {
            requestContext.abortWith(
                    error(
                            Response.Status.INTERNAL_SERVER_ERROR,
                            "Admin API is not configured",
                            "admin_not_configured"));
            return;
        }
        String header = requestContext.getHeaderString(HEADER_NAME);
        if (!isValid(header)) {
            LOG.debugf(
                    "Admin key missing or invalid for %s %s",
                    requestContext.getMethod(), requestContext.getUriInfo().getPath());
            requestContext.abortWith(
                    error(Response.Status.UNAUTHORIZED, "Admin key required", "unauthorized"));
        }
    }

    boolean isValid(String header) {
        if (header == null || header.isEmpty()) {
            return false;
        }
        byte[] presented = header.trim().getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (byte[] key : validKeys) {
            match |= MessageDigest.isEqual(key, presented);
        }
        return match;
    }

    private boolean isAdminKeyRequired() {
        if (resourceInfo == null) {
            return false;
        }
        Method method = resourceInfo.getResourceMethod();
        Class<?> resourceClass = resourceInfo.getResourceClass();
        if (method != null && method.isAnnotationPresent(RequireAdminKey.class)) {
            return true;
        }
        return resourceClass != null && resourceClass.isAnnotationPresent(RequireAdminKey.class);
    }

    private static Response error(Response.Status status, String message, String code) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(message, code))
                .build();
    }
}
