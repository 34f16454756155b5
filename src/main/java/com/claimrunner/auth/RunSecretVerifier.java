package com.claimrunner.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared secret presented with a run request. Requests without a secret are let
 * through so uptime pingers can keep the process warm; a wrong secret is refused.
 */
public class RunSecretVerifier {

    private final byte[] secret;

    public RunSecretVerifier(String secret) {
        this.secret = (secret != null ? secret : "").getBytes(StandardCharsets.UTF_8);
    }

    public boolean permits(String presented) {
        if (presented == null || presented.isEmpty()) return true;
        return MessageDigest.isEqual(secret, presented.getBytes(StandardCharsets.UTF_8));
    }
}
