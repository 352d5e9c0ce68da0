package com.taskherd.engine.webhook;

import com.taskherd.engine.config.TaskherdProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks {@code X-Hub-Signature-256} headers: {@code sha256=} followed by the
 * hex HMAC-SHA256 of the exact request body under the shared secret.
 *
 * The comparison is constant-time. With no secret configured every request
 * is rejected.
 */
@Component
public class SignatureVerifier {

    static final String PREFIX    = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] secret;

    @Autowired
    public SignatureVerifier(TaskherdProperties props) {
        this(props.webhook().secret());
    }

    SignatureVerifier(String secret) {
        this.secret = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
    }

    /** @throws SignatureVerificationException if the header does not match the body */
    public void verify(byte[] body, String signatureHeader) {
        if (secret.length == 0) {
            throw new SignatureVerificationException("no webhook secret configured");
        }
        if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
            throw new SignatureVerificationException("missing or malformed signature header");
        }
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHeader.substring(PREFIX.length()).trim());
        } catch (IllegalArgumentException e) {
            throw new SignatureVerificationException("signature is not hex");
        }
        if (!MessageDigest.isEqual(sign(body), provided)) {
            throw new SignatureVerificationException("signature mismatch");
        }
    }

    /** Header value a sender with the same secret would produce. */
    public String signatureFor(byte[] body) {
        return PREFIX + HexFormat.of().formatHex(sign(body));
    }

    private byte[] sign(byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        }
    }
}
