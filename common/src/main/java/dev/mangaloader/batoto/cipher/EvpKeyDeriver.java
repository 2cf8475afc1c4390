package dev.mangaloader.batoto.cipher;

import dev.mangaloader.batoto.PageResolutionException;
import org.jetbrains.annotations.NotNull;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.KEY_DERIVATION_FAILED;

/**
 * Key and IV derivation compatible with OpenSSL's {@code EVP_BytesToKey} using MD5 and a single iteration, which is
 * what {@code openssl enc} and CryptoJS use for passphrase based encryption.
 */
public final class EvpKeyDeriver {
  public static final int SALT_LENGTH = 8;

  private EvpKeyDeriver() {
  }

  /**
   * Derives key material from a password and salt. {@code D(i) = MD5(D(i-1) || password || salt)}, the concatenation
   * of all {@code D(i)} is truncated to {@code keyLength + ivLength} bytes and split into key and IV.
   *
   * @param password  Password bytes, must not be empty
   * @param salt      Salt, exactly {@link #SALT_LENGTH} bytes
   * @param keyLength Key length in bytes
   * @param ivLength  IV length in bytes
   * @return Derived key and IV
   */
  @NotNull
  public static DerivedKeyMaterial derive(@NotNull byte[] password, @NotNull byte[] salt, int keyLength, int ivLength) {
    if (password.length == 0) {
      throw new PageResolutionException("Password must not be empty", KEY_DERIVATION_FAILED);
    } else if (salt.length != SALT_LENGTH) {
      throw new PageResolutionException("Salt must be " + SALT_LENGTH + " bytes, got " + salt.length,
          KEY_DERIVATION_FAILED);
    } else if (keyLength <= 0 || ivLength <= 0) {
      throw new PageResolutionException("Key and IV lengths must be positive, got " + keyLength + "/" + ivLength,
          KEY_DERIVATION_FAILED);
    }

    MessageDigest md5 = createDigest();
    byte[] output = new byte[keyLength + ivLength];
    byte[] previous = new byte[0];
    int filled = 0;

    while (filled < output.length) {
      md5.update(previous);
      md5.update(password);
      md5.update(salt);
      byte[] block = md5.digest();

      int count = Math.min(block.length, output.length - filled);
      System.arraycopy(block, 0, output, filled, count);
      filled += count;

      Arrays.fill(previous, (byte) 0);
      previous = block;
    }

    Arrays.fill(previous, (byte) 0);

    byte[] key = Arrays.copyOfRange(output, 0, keyLength);
    byte[] iv = Arrays.copyOfRange(output, keyLength, output.length);
    Arrays.fill(output, (byte) 0);

    return new DerivedKeyMaterial(key, iv);
  }

  private static MessageDigest createDigest() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException e) {
      throw new PageResolutionException("MD5 is not available", KEY_DERIVATION_FAILED, e);
    }
  }
}
