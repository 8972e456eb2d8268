package com.example.JobCopilot.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKMatcher;
import com.nimbusds.jose.jwk.JWKSelector;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwksCacheTest {

    @Test
    void registeredKeysAreServedWithoutFetching() throws JOSEException {
        RSAKey key = new RSAKeyGenerator(2048).keyID("key-1").generate();
        JwksCache cache = new JwksCache(Duration.ofMinutes(5), Clock.systemUTC());
        cache.register("https://team.example.com/certs", new JWKSet(key.toPublicJWK()));

        List<JWK> keys = cache.get("https://team.example.com/certs")
                .get(new JWKSelector(new JWKMatcher.Builder().keyID("key-1").build()), null);

        assertThat(keys).hasSize(1);
    }

    @Test
    void unreachableJwksIsServerError() {
        JwksCache cache = new JwksCache(Duration.ZERO, Clock.systemUTC());

        assertThatThrownBy(() -> cache.get("http://127.0.0.1:1/certs"))
                .isInstanceOfSatisfying(AccessAuthException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR));
    }
}
