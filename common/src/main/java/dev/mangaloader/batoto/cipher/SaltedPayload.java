package dev.mangaloader.batoto.cipher;

import dev.mangaloader.batoto.PageResolutionException;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.DECODE_FAILED;

/**
 * OpenSSL salted payload: 8 byte {@code Salted__} marker, 8 byte salt, then the ciphertext.
 */
public final class SaltedPayload {
  private static final byte[] MARKER = "Salted__".getBytes(StandardCharsets.US_ASCII);
  private static final int HEADER_LENGTH = MARKER.length + EvpKeyDeriver.SALT_LENGTH;

  private final byte[] salt;
  private final byte[] ciphertext;

  private SaltedPayload(byte[] salt, byte[] ciphertext) {
    this.salt = salt;
    this.ciphertext = ciphertext;
  }

  /**
   * @param encoded Base64 text of the payload, surrounding whitespace is ignored
   * @return Parsed payload
   */
  @NotNull
  public static SaltedPayload decode(@NotNull String encoded) {
    byte[] raw;

    try {
      raw = Base64.getDecoder().decode(encoded.trim());
    } catch (IllegalArgumentException e) {
      throw new PageResolutionException("Encoded word is not valid base64: " + e.getMessage(), DECODE_FAILED, e);
    }

    return fromBytes(raw);
  }

  @NotNull
  public static SaltedPayload fromBytes(@NotNull byte[] raw) {
    if (raw.length < HEADER_LENGTH) {
      throw new PageResolutionException("Payload is " + raw.length + " bytes, shorter than its " + HEADER_LENGTH +
          " byte header", DECODE_FAILED);
    }

    if (!Arrays.equals(raw, 0, MARKER.length, MARKER, 0, MARKER.length)) {
      throw new PageResolutionException("Payload does not start with the Salted__ marker", DECODE_FAILED);
    }

    return new SaltedPayload(
        Arrays.copyOfRange(raw, MARKER.length, HEADER_LENGTH),
        Arrays.copyOfRange(raw, HEADER_LENGTH, raw.length)
    );
  }

  /**
   * @return Copy of the salt
   */
  @NotNull
  public byte[] getSalt() {
    return salt.clone();
  }

  /**
   * @return Copy of the ciphertext
   */
  @NotNull
  public byte[] getCiphertext() {
    return ciphertext.clone();
  }
}
