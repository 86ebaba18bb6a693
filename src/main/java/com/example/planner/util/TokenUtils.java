package com.example.planner.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Base64;

/**
 * Opaque token generation, hashing and log masking.
 */
public final class TokenUtils {

  private static final int TOKEN_ENTROPY_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private TokenUtils() {}

  /**
   * 32 random bytes, base64url without padding (43 characters).
   */
  public static String generateToken() {
    byte[] randomBytes = new byte[TOKEN_ENTROPY_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
  }

  public static boolean isWellFormed(String token) {
    return token != null && token.length() >= 42 && token.length() <= 44;
  }

  /**
   * Hex SHA-256, used as the stored form of access and refresh tokens.
   */
  public static String sha256Hex(String input) {
    return HexFormat.of().formatHex(digest(input));
  }

  public static String sha256Base64(String input) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(digest(input));
  }

  public static String maskToken(String token) {
    if (token == null || token.length() < 8) return "INVALID";
    return token.substring(0, 8) + "...";
  }

  public static String maskAddress(String ip) {
    if (ip == null || !ip.contains(".")) {
      return "***";
    }
    String[] parts = ip.split("\\.");
    if (parts.length == 4) {
      return parts[0] + "." + parts[1] + ".***." + parts[3];
    }
    return "***";
  }

  private static byte[] digest(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(input.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
