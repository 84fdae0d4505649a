package com.example.media_acquisition.service.credentials;

public record CredentialLease(String pool, String secret) {
    @Override
    public String toString() {
        return pool + ":" + mask(secret);
    }

    public static String mask(String secret) {
        if (secret == null || secret.length() <= 6) {
            return "***";
        }
        return secret.substring(0, 4) + "***" + secret.substring(secret.length() - 2);
    }
}
