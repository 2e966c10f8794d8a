package dev.flowsync.infrastructure.engine;

import dev.flowsync.config.EngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Authenticates callbacks posted by the execution engine.
 * <p>
 * The engine signs the raw request body with the shared callback secret and sends
 * {@code X-Engine-Signature: sha256=<64 hex chars>}. The header is decoded to the raw
 * digest and compared in constant time against the digest of the body as received.
 * Without a configured secret every callback is refused.
 */
@Component
public class EngineSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(EngineSignatureVerifier.class);
    private static final String ALGORITHM = "HmacSHA256";
    private static final String SCHEME = "sha256=";
    private static final int DIGEST_LENGTH = 32;

    /** Why a callback was accepted or refused; the reason is echoed back to the engine. */
    public enum Verdict {
        ACCEPTED("ok"),
        MISSING("missing signature"),
        MALFORMED("malformed signature"),
        MISMATCH("invalid signature"),
        UNCONFIGURED("callbacks disabled");

        private final String reason;

        Verdict(String reason) { this.reason = reason; }

        public String reason() { return reason; }

        public boolean accepted() { return this == ACCEPTED; }
    }

    private final SecretKeySpec callbackKey;

    public EngineSignatureVerifier(EngineProperties properties) {
        String secret = properties.callbackSecret();
        this.callbackKey = secret == null || secret.isBlank()
                ? null
                : new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        if (callbackKey == null) log.warn("No engine callback secret configured; /engine/events will refuse all calls");
    }

    public Verdict authenticate(byte[] body, String signatureHeader) {
        if (callbackKey == null) return Verdict.UNCONFIGURED;
        if (signatureHeader == null || signatureHeader.isBlank()) return Verdict.MISSING;

        byte[] claimed = decode(signatureHeader.trim());
        if (claimed == null) return Verdict.MALFORMED;
        try {
            return MessageDigest.isEqual(digest(callbackKey, body), claimed) ? Verdict.ACCEPTED : Verdict.MISMATCH;
        } catch (GeneralSecurityException e) {
            log.error("Could not compute engine callback digest", e);
            return Verdict.MISMATCH;
        }
    }

    private static byte[] decode(String header) {
        if (!header.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) return null;
        String hex = header.substring(SCHEME.length());
        if (hex.length() != DIGEST_LENGTH * 2) return null;
        try {
            return HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            log.debug("Engine signature is not hex: {}", e.getMessage());
            return null;
        }
    }

    private static byte[] digest(SecretKeySpec key, byte[] body) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(key);
        return mac.doFinal(body);
    }

    /** Header value the engine is expected to send for {@code body}. */
    static String signatureHeader(String secret, byte[] body) throws GeneralSecurityException {
        byte[] raw = digest(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM), body);
        return SCHEME + HexFormat.of().formatHex(raw);
    }
}
