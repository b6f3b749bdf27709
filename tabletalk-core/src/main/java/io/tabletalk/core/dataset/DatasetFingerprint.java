package io.tabletalk.core.dataset;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class DatasetFingerprint {

    private DatasetFingerprint() {
    }

    public static String of(byte[] bytes) {
        byte[] safe = bytes == null ? new byte[0] : bytes;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(safe)) + ":" + safe.length;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
