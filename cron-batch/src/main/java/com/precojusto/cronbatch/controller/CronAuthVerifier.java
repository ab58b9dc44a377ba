package com.precojusto.cronbatch.controller;

import com.precojusto.cronbatch.exception.CronUnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared secret sent by the scheduler, either as
 * {@code Authorization: Bearer <secret>} or as {@code X-Cron-Secret}.
 */
@Component
@Slf4j
public class CronAuthVerifier {

    static final String BEARER_PREFIX = "Bearer ";

    private final String secret;
    private final boolean allowUnauthenticated;

    public CronAuthVerifier(@Value("${batch.cron.secret:}") String secret,
            @Value("${batch.cron.allow-unauthenticated:false}") boolean allowUnauthenticated) {
        this.secret = secret;
        this.allowUnauthenticated = allowUnauthenticated;
    }

    public void verify(String authorization, String cronSecretHeader) {
        if (secret == null || secret.isBlank()) {
            if (allowUnauthenticated) {
                return;
            }
            log.warn("Cron call rejected: no secret configured");
            throw new CronUnauthorizedException("Cron secret not configured");
        }

        String presented = cronSecretHeader;
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            presented = authorization.substring(BEARER_PREFIX.length()).trim();
        }

        if (presented == null || !matches(presented)) {
            log.warn("Cron call rejected: missing or invalid secret");
            throw new CronUnauthorizedException("Unauthorized");
        }
    }

    private boolean matches(String presented) {
        return MessageDigest.isEqual(secret.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
