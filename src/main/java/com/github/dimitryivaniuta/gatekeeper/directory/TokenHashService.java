package com.github.dimitryivaniuta.gatekeeper.directory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Keyed digest of API tokens. The pepper is the HMAC key and never leaves the process.
 *
 * <p>Stored values have the form {@code v1$<hex>}, where the prefix names the token hash format.
 * Lookups hash the presented token the same way and compare stored strings, so raw tokens never reach
 * the database.
 */
public class TokenHashService {

    static final String FORMAT_VERSION = "v1";
    private static final String SEPARATOR = "$";
    private static final int RAW_TOKEN_BYTES = 32;
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom = new SecureRandom();
    private final SecretKeySpec key;

    /**
     * @param pepper    HMAC key; blank is rejected so tokens are never hashed unkeyed
     * @param algorithm a JCA MAC algorithm, e.g. {@code HmacSHA256}
     */
    public TokenHashService(String pepper, String algorithm) {
        if (pepper == null || pepper.isBlank()) {
            throw new IllegalStateException("gatekeeper.token-auth.pepper must be set");
        }
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalStateException("gatekeeper.token-auth.hash-algorithm must be set");
        }
        this.key = new SecretKeySpec(pepper.getBytes(StandardCharsets.UTF_8), algorithm.trim());
        newMac();
    }

    /** 256-bit random token, base64url without padding. Handed out once at creation. */
    public String generateRawToken() {
        byte[] buf = new byte[RAW_TOKEN_BYTES];
        secureRandom.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }

    public String hash(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new IllegalArgumentException("rawToken must not be blank");
        }
        byte[] mac = newMac().doFinal(rawToken.getBytes(StandardCharsets.UTF_8));
        return FORMAT_VERSION + SEPARATOR + HEX.formatHex(mac);
    }

    // Mac instances are stateful and not thread-safe
    private Mac newMac() {
        try {
            Mac mac = Mac.getInstance(key.getAlgorithm());
            mac.init(key);
            return mac;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unsupported token hash algorithm: " + key.getAlgorithm(), e);
        }
    }
}
