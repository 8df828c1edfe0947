package ca.gc.cra.meshgate.application.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Random;

/**
 * Hashes a fresh random value together with the sender and body, keeping the first
 * {@value #ID_LENGTH} hex characters of the MD5 digest.
 *
 * @since 0.1.0
 */
public final class Md5MessageIdGenerator implements MessageIdGenerator {
  /** Number of hex characters retained from the digest. */
  public static final int ID_LENGTH = 10;

  private final Random random;

  /**
   * Creates a generator seeded from {@link SecureRandom}.
   */
  public Md5MessageIdGenerator() {
    this(new SecureRandom());
  }

  /**
   * Creates a generator drawing salts from {@code random}.
   *
   * @param random salt source; must not be {@code null}
   */
  public Md5MessageIdGenerator(Random random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public String generate(long nodeNum, String text) {
    MessageDigest md5 = newDigest();
    md5.update(Double.toString(random.nextDouble()).getBytes(StandardCharsets.UTF_8));
    md5.update(Long.toString(nodeNum).getBytes(StandardCharsets.UTF_8));
    md5.update(Objects.requireNonNull(text, "text").getBytes(StandardCharsets.UTF_8));
    return HexFormat.of().formatHex(md5.digest()).substring(0, ID_LENGTH);
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException ex) {
      // Every Java SE platform must ship MD5.
      throw new IllegalStateException("MD5 digest unavailable", ex);
    }
  }
}
