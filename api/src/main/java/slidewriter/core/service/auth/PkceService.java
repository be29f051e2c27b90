package slidewriter.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates PKCE verifiers, challenges and state tokens.
 *
 * <p>Implements RFC 7636 with the S256 challenge method only; the plain method
 * offers no protection against code interception.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
@ApplicationScoped
public class PkceService {

    static final String S256_METHOD = "S256";
    private static final int VERIFIER_LENGTH = 64;
    private static final int STATE_LENGTH = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    /**
     * Generate a cryptographically secure code verifier.
     *
     * <p>64 random bytes encode to 86 characters, inside the 43-128 range
     * RFC 7636 allows, using only unreserved characters.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateCodeVerifier() {
        byte[] randomBytes = new byte[VERIFIER_LENGTH];
        SECURE_RANDOM.nextBytes(randomBytes);
        return ENCODER.encodeToString(randomBytes);
    }

    /**
     * Generate S256 challenge from verifier.
     *
     * <p>Computes: BASE64URL(SHA256(verifier))
     *
     * @param verifier The code verifier
     * @return Base64URL encoded SHA-256 hash of the verifier
     */
    public String generateChallenge(String verifier) {
        if (verifier == null || verifier.isBlank()) {
            throw new IllegalArgumentException("verifier must not be null or blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return ENCODER.encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Generate a 256-bit anti-forgery state token.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateState() {
        final var bytes = new byte[STATE_LENGTH];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    public String challengeMethod() {
        return S256_METHOD;
    }
}
