package com.numaansystems.portal.totp;

/**
 * Time-based one-time password check (RFC 6238).
 *
 * <p>Pure computation, no I/O.</p>
 */
public interface TotpVerifier {

    /**
     * @param secret base32 shared secret
     * @param code normalized 6-digit code
     * @param window number of time steps accepted on either side of the current one
     * @return whether the code matches any accepted time step
     * @throws IllegalArgumentException if the secret is not valid base32
     */
    boolean verify(String secret, String code, int window);

    /**
     * Builds the {@code otpauth://} URI an authenticator app scans during enrollment.
     */
    String provisioningUri(String username, String secret, String issuer);
}
