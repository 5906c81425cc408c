package com.flagship.split_escrow.webhook;

import com.flagship.split_escrow.exception.InvalidSignatureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Accepts a delivery whose signature header equals the provider's shared
 * secret ({@code webhook.secrets.<provider>}). Providers without a configured
 * secret are rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SharedSecretSignatureVerifier implements WebhookSignatureVerifier {

    private final Environment environment;

    @Override
    public void verify(String provider, String rawBody, String signature) {
        String secret = environment.getProperty("webhook.secrets." + provider);
        if (secret == null || secret.isBlank()) {
            log.warn("No webhook secret configured for provider {}", provider);
            throw new InvalidSignatureException(provider);
        }
        if (signature == null
                || !MessageDigest.isEqual(secret.getBytes(StandardCharsets.UTF_8),
                        signature.getBytes(StandardCharsets.UTF_8))) {
            throw new InvalidSignatureException(provider);
        }
    }
}
