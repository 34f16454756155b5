package com.claimrunner.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunSecretVerifierTest {

    @Test
    void matchingSecretIsPermitted() {
        assertTrue(new RunSecretVerifier("s3cret").permits("s3cret"));
    }

    @Test
    void wrongSecretIsRefused() {
        var verifier = new RunSecretVerifier("s3cret");

        assertFalse(verifier.permits("s3cre"));
        assertFalse(verifier.permits("s3cret "));
        assertFalse(verifier.permits("S3CRET"));
    }

    @Test
    void absentSecretIsPermitted() {
        var verifier = new RunSecretVerifier("s3cret");

        assertTrue(verifier.permits(null));
        assertTrue(verifier.permits(""));
    }

    @Test
    void blankConfiguredSecretRefusesAnyPresentedValue() {
        var verifier = new RunSecretVerifier("");

        assertFalse(verifier.permits("anything"));
        assertTrue(verifier.permits(null));
    }
}
