package com.taskherd.engine.webhook;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignatureVerifierTest {

    private final SignatureVerifier verifier = new SignatureVerifier("It's a Secret to Everybody");

    @Test
    void knownVector_isAccepted() {
        // Example from the GitHub webhook documentation
        byte[] body = "Hello, World!".getBytes(StandardCharsets.UTF_8);
        String header = "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17";

        assertThat(verifier.signatureFor(body)).isEqualTo(header);
        assertThatCode(() -> verifier.verify(body, header)).doesNotThrowAnyException();
    }

    @Test
    void tamperedBody_isRejected() {
        byte[] body = "{\"action\":\"opened\"}".getBytes(StandardCharsets.UTF_8);
        String header = verifier.signatureFor(body);
        byte[] tampered = "{\"action\":\"closed\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> verifier.verify(tampered, header))
                .isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void missingOrMalformedHeader_isRejected() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> verifier.verify(body, null)).isInstanceOf(SignatureVerificationException.class);
        assertThatThrownBy(() -> verifier.verify(body, "sha1=abcd")).isInstanceOf(SignatureVerificationException.class);
        assertThatThrownBy(() -> verifier.verify(body, "sha256=not-hex")).isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void otherSecret_isRejected() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        String forged = new SignatureVerifier("guess").signatureFor(body);

        assertThatThrownBy(() -> verifier.verify(body, forged)).isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void noSecretConfigured_rejectsEverything() {
        SignatureVerifier unconfigured = new SignatureVerifier("");
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> unconfigured.verify(body, verifier.signatureFor(body)))
                .isInstanceOf(SignatureVerificationException.class);
    }
}
