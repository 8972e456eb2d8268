package com.example.JobCopilot.security;

import com.example.JobCopilot.config.CopilotProperties;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key sets by JWKS URL.
 * <p>
 * Remote sets are fetched on first use and refreshed after the TTL (zero keeps them for the
 * life of the process). A failed refresh keeps serving the previous set. Sets installed with
 * {@link #register(String, JWKSet)} never expire and are never fetched.
 */
@Component
public class JwksCache {

    private static final Logger log = LoggerFactory.getLogger(JwksCache.class);

    private final Map<String, CachedKeySet> keySets = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public JwksCache(CopilotProperties properties) {
        this(properties.getAccess().getJwksCacheTtl(), Clock.systemUTC());
    }

    public JwksCache(Duration ttl, Clock clock) {
        this.ttl = ttl == null ? Duration.ZERO : ttl;
        this.clock = clock;
    }

    public JWKSource<SecurityContext> get(String jwksUrl) {
        CachedKeySet cached = keySets.compute(jwksUrl, (url, existing) -> {
            if (existing != null && !existing.isExpired(clock.instant())) {
                return existing;
            }
            return refresh(url, existing);
        });
        return new ImmutableJWKSet<>(cached.keys());
    }

    /** Installs a local key set for the URL, replacing anything cached. */
    public void register(String jwksUrl, JWKSet keys) {
        keySets.put(jwksUrl, new CachedKeySet(keys, null));
    }

    private CachedKeySet refresh(String url, CachedKeySet previous) {
        try {
            JWKSet loaded = JWKSet.load(URI.create(url).toURL());
            Instant expiresAt = ttl.isZero() ? null : clock.instant().plus(ttl);
            log.info("JWKS refreshed from {}: {} keys", url, loaded.getKeys().size());
            return new CachedKeySet(loaded, expiresAt);
        } catch (IOException | ParseException | IllegalArgumentException e) {
            if (previous != null) {
                log.warn("JWKS refresh from {} failed, keeping previous keys: {}", url, e.getMessage());
                return new CachedKeySet(previous.keys(), clock.instant().plus(ttl));
            }
            log.error("Unable to load JWKS from {}: {}", url, e.getMessage());
            throw new AccessAuthException(HttpStatus.INTERNAL_SERVER_ERROR, "Access auth keys unavailable", e);
        }
    }

    private record CachedKeySet(JWKSet keys, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
