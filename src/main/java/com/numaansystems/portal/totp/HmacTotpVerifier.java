package com.numaansystems.portal.totp;

import com.numaansystems.portal.config.PortalProperties;
import org.apache.commons.codec.binary.Base32;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * RFC 6238 verifier: HMAC-SHA1, 6 digits, configurable step (30 seconds by default).
 *
 * <p>Every candidate in the window is computed and compared in constant time, so the response
 * time does not reveal which time step matched.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class HmacTotpVerifier implements TotpVerifier {

    private static final String ALGORITHM = "HmacSHA1";
    private static final int DIGITS = 6;
    private static final int MODULUS = 1_000_000;

    private final Clock clock;
    private final long stepSeconds;

    @Autowired
    public HmacTotpVerifier(Clock clock, PortalProperties properties) {
        this(clock, properties.getTotp().getStep());
    }

    public HmacTotpVerifier(Clock clock, Duration step) {
        this.clock = clock;
        this.stepSeconds = step.getSeconds();
        if (stepSeconds <= 0) {
            throw new IllegalArgumentException("TOTP step must be at least one second");
        }
    }

    @Override
    public boolean verify(String secret, String code, int window) {
        if (code == null || code.length() != DIGITS) {
            return false;
        }
        byte[] key = decodeSecret(secret);
        long counter = counterAt(clock.instant());
        byte[] submitted = code.getBytes(StandardCharsets.US_ASCII);

        boolean matched = false;
        for (long offset = -window; offset <= window; offset++) {
            byte[] expected = generate(key, counter + offset).getBytes(StandardCharsets.US_ASCII);
            matched |= MessageDigest.isEqual(expected, submitted);
        }
        return matched;
    }

    /**
     * Code valid for the time step containing {@code at}.
     */
    public String generate(String secret, Instant at) {
        return generate(decodeSecret(secret), counterAt(at));
    }

    @Override
    public String provisioningUri(String username, String secret, String issuer) {
        String label = URLEncoder.encode(issuer + ":" + username, StandardCharsets.UTF_8).replace("+", "%20");
        return "otpauth://totp/" + label
                + "?secret=" + normalizeSecret(secret)
                + "&issuer=" + URLEncoder.encode(issuer, StandardCharsets.UTF_8).replace("+", "%20")
                + "&algorithm=SHA1&digits=" + DIGITS + "&period=" + stepSeconds;
    }

    private long counterAt(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), stepSeconds);
    }

    private String generate(byte[] key, long counter) {
        byte[] message = new byte[8];
        long value = counter;
        for (int i = 7; i >= 0; i--) {
            message[i] = (byte) (value & 0xff);
            value >>>= 8;
        }

        byte[] hash;
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            hash = mac.doFinal(message);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 not available", e);
        }

        // dynamic truncation, RFC 4226 section 5.3
        int offset = hash[hash.length - 1] & 0x0f;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);

        return String.format("%0" + DIGITS + "d", binary % MODULUS);
    }

    private static byte[] decodeSecret(String secret) {
        String normalized = normalizeSecret(secret);
        Base32 base32 = new Base32();
        if (normalized.isEmpty() || !base32.isInAlphabet(normalized)) {
            throw new IllegalArgumentException("TOTP secret is not valid base32");
        }
        return base32.decode(normalized);
    }

    private static String normalizeSecret(String secret) {
        if (secret == null) {
            return "";
        }
        return secret.replace(" ", "").replace("=", "").toUpperCase(Locale.ROOT);
    }
}
