package ca.gc.cra.teleq.application.query;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Content address of a cached query result.
 *
 * <p>SHA-256 over the profile identity, the normalized query text and the effective row limit, so queries that
 * differ only in surrounding or repeated whitespace share an entry while different profiles never do.</p>
 */
public final class QueryFingerprint {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private QueryFingerprint() {}

  /**
   * Computes a fingerprint.
   *
   * @param profileIdentity profile identity
   * @param query query text
   * @param rowLimit effective row limit; {@code 0} for unlimited
   * @return 64 lower-case hex characters
   */
  public static String of(String profileIdentity, String query, int rowLimit) {
    Objects.requireNonNull(profileIdentity, "profileIdentity");
    String material = profileIdentity + '\n' + normalize(query) + '\n' + rowLimit;
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  /**
   * Trims the query and collapses whitespace runs to a single space.
   *
   * @param query query text
   * @return normalized text
   */
  public static String normalize(String query) {
    return WHITESPACE.matcher(Objects.requireNonNull(query, "query").trim()).replaceAll(" ");
  }

  /**
   * Reports whether a string looks like a fingerprint.
   *
   * @param value candidate
   * @return {@code true} for 64 lower-case hex characters
   */
  public static boolean isValid(String value) {
    if (value == null || value.length() != 64) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
        return false;
      }
    }
    return true;
  }
}
