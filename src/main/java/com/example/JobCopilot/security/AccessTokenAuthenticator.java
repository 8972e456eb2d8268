package com.example.JobCopilot.security;

import com.example.JobCopilot.repository.AccessIdentityRepository;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.proc.BadJOSEException;
import com.nimbusds.jose.proc.JWSVerificationKeySelector;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.proc.DefaultJWTClaimsVerifier;
import com.nimbusds.jwt.proc.DefaultJWTProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.ParseException;
import java.util.Set;

/**
 * Verifies an identity-provider token against a JWKS and maps it to a local user.
 * <ol>
 *   <li>missing token: 401</li>
 *   <li>JWKS URL or audience not configured: 500</li>
 *   <li>bad signature, audience, issuer or expiry: 401</li>
 *   <li>no issuer or subject ({@code sub}, else {@code common_name}): 401</li>
 *   <li>(issuer, subject) not mapped to a user: 403</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessTokenAuthenticator {

    private static final Set<JWSAlgorithm> ALLOWED_ALGORITHMS = Set.of(
            JWSAlgorithm.RS256, JWSAlgorithm.RS384, JWSAlgorithm.RS512,
            JWSAlgorithm.ES256, JWSAlgorithm.ES384);

    private final JwksCache jwksCache;
    private final AccessIdentityRepository accessIdentityRepository;

    public AccessIdentity authenticate(String token, String jwksUrl, String issuer, String audience) {
        if (isBlank(token)) {
            throw AccessAuthException.unauthorized("Missing access token");
        }
        if (isBlank(jwksUrl) || isBlank(audience)) {
            throw AccessAuthException.notConfigured();
        }

        JWTClaimsSet claims = verify(token, jwksUrl, issuer, audience);

        String tokenIssuer = claims.getIssuer();
        String subject = subjectOf(claims);
        if (isBlank(tokenIssuer) || isBlank(subject)) {
            throw AccessAuthException.unauthorized("Invalid access token");
        }

        return accessIdentityRepository.findByIssuerAndSubject(tokenIssuer, subject)
                .orElseThrow(() -> {
                    log.warn("Access identity not mapped for issuer {}", tokenIssuer);
                    return AccessAuthException.forbidden("Access identity not mapped");
                });
    }

    private JWTClaimsSet verify(String token, String jwksUrl, String issuer, String audience) {
        DefaultJWTProcessor<SecurityContext> processor = new DefaultJWTProcessor<>();
        processor.setJWSKeySelector(new JWSVerificationKeySelector<>(ALLOWED_ALGORITHMS, jwksCache.get(jwksUrl)));

        JWTClaimsSet exactMatch = isBlank(issuer)
                ? new JWTClaimsSet.Builder().build()
                : new JWTClaimsSet.Builder().issuer(issuer).build();
        processor.setJWTClaimsSetVerifier(new DefaultJWTClaimsVerifier<>(audience, exactMatch, Set.of("iss")));

        try {
            return processor.process(token, null);
        } catch (ParseException | BadJOSEException | JOSEException e) {
            log.debug("Access token rejected: {}", e.getMessage());
            throw AccessAuthException.unauthorized("Invalid access token");
        }
    }

    private static String subjectOf(JWTClaimsSet claims) {
        if (!isBlank(claims.getSubject())) {
            return claims.getSubject();
        }
        Object commonName = claims.getClaim("common_name");
        return commonName instanceof String ? (String) commonName : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
