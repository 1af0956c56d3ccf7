package com.licenseguard.api.identity;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * <p>
 * A {@link OncePerRequestFilter OncePerRequest} security filter that validates the lease token
 * passed as a <i>bearer</i> token in the <i>Authorization</i> request header, against the device
 * fingerprint passed in the <i>X-Device-Id</i> request header.</p>
 *
 * <p>
 * If either header is missing, the filter leaves the existing {@link
 * org.springframework.security.core.context.SecurityContext SecurityContext} untouched. Otherwise,
 * it sets a new {@link org.springframework.security.core.context.SecurityContext SecurityContext}
 * whose {@link org.springframework.security.core.Authentication Authentication} is non-null only
 * if the lease is valid and was issued to the presenting device.</p>
 */
@Component
public class LeaseTokenAuthFilter extends OncePerRequestFilter {

    public static final String DEVICE_ID_HEADER = "X-Device-Id";

    private final LeaseTokenService leaseTokenService;

    @Autowired
    LeaseTokenAuthFilter(@NonNull LeaseTokenService leaseTokenService) {
        this.leaseTokenService = leaseTokenService;
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        verifyAuthorizationHeader(request);
        filterChain.doFilter(request, response);
    }

    private void verifyAuthorizationHeader(@NonNull HttpServletRequest request) {
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            return; // a previous filter may have performed authentication.
        }

        val header = request.getHeader("authorization");
        val deviceHash = request.getHeader(DEVICE_ID_HEADER);
        if (header == null || !header.toLowerCase().startsWith("bearer ") || deviceHash == null) {
            return;
        }

        val context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(leaseTokenService.verifyLeaseTokenOrNull(header.substring(7), deviceHash));
        SecurityContextHolder.setContext(context);
    }
}
