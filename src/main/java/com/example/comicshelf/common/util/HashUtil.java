package com.example.comicshelf.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtil {

    private static final int BUFFER_SIZE = 64 * 1024;

    private HashUtil() {
    }

    public static String md5Hex(String text) {
        MessageDigest messageDigest = newMd5();
        return toHex(messageDigest.digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Streams the file through MD5 without loading it whole.
     */
    public static String md5Hex(Path file) throws IOException {
        MessageDigest messageDigest = newMd5();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                messageDigest.update(buffer, 0, read);
            }
        }
        return toHex(messageDigest.digest());
    }

    private static MessageDigest newMd5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
