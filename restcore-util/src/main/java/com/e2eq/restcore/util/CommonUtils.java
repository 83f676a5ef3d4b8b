package com.e2eq.restcore.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public class CommonUtils {

    private static final String CHARACTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Random string of ascii letters and digits
     *
     * @param length number of characters
     * @return the generated string
     */
    public static String randomPrintable(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(CHARACTERS.charAt(RANDOM.nextInt(CHARACTERS.length())));
        }
        return sb.toString();
    }

    /**
     * SHA-256 hex digest of the password wrapped on both sides with the salt.
     *
     * @param password the clear text password
     * @param salt the configured salt
     * @return lower case hex digest
     */
    public static String hashPassword(String password, String salt) {
        if (password == null) {
            throw new IllegalArgumentException("password can not be null");
        }
        String salted = (salt == null ? "" : salt) + password + (salt == null ? "" : salt);
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("SHA-256");
            byte[] array = messageDigest.digest(salted.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(array);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Opaque token: three random digits followed by a dash-less random UUID.
     */
    public static String generateToken() {
        return (100 + RANDOM.nextInt(900)) + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Copy of {@code data} restricted to the given keys, keeping the iteration order of {@code data}.
     */
    public static <V> Map<String, V> filterFields(Map<String, V> data, Collection<String> fieldSet) {
        Map<String, V> out = new LinkedHashMap<>();
        if (data == null || fieldSet == null) {
            return out;
        }
        data.forEach((k, v) -> {
            if (fieldSet.contains(k)) {
                out.put(k, v);
            }
        });
        return out;
    }

    /**
     * Renders a non negative number in the given base using digits and upper case letters.
     */
    public static String baseN(long num, int base) {
        if (base < 2 || base > 36) {
            throw new IllegalArgumentException("Invalid base; supported range is 2-36");
        }
        if (num < 0) {
            throw new IllegalArgumentException("num can not be negative");
        }
        return Long.toString(num, base).toUpperCase();
    }
}
