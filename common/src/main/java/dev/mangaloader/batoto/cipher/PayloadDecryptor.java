package dev.mangaloader.batoto.cipher;

import dev.mangaloader.batoto.PageResolutionException;
import org.jetbrains.annotations.NotNull;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.CIPHER_FAILED;
import static dev.mangaloader.batoto.PageResolutionException.FailureType.DECODE_FAILED;

/**
 * Decrypts {@link SaltedPayload}s produced with AES-256-CBC and an {@code EVP_BytesToKey} derived key.
 *
 * <p>Padding is checked strictly: if the trailing PKCS#7 block is not well formed the call fails instead of returning
 * the raw bytes, since a bad pad almost always means the password was wrong.
 */
public final class PayloadDecryptor {
  public static final int KEY_LENGTH = 32;
  public static final int IV_LENGTH = 16;
  public static final int BLOCK_SIZE = 16;

  private PayloadDecryptor() {
  }

  /**
   * @param payload  Payload to decrypt
   * @param password Password to derive the key and IV from
   * @return Plaintext decoded as UTF-8
   */
  @NotNull
  public static String decrypt(@NotNull SaltedPayload payload, @NotNull String password) {
    byte[] ciphertext = payload.getCiphertext();

    if (ciphertext.length == 0 || ciphertext.length % BLOCK_SIZE != 0) {
      throw new PageResolutionException("Ciphertext length " + ciphertext.length + " is not a positive multiple of " +
          BLOCK_SIZE, CIPHER_FAILED);
    }

    byte[] passwordBytes = password.getBytes(StandardCharsets.UTF_8);
    DerivedKeyMaterial material;

    try {
      material = EvpKeyDeriver.derive(passwordBytes, payload.getSalt(), KEY_LENGTH, IV_LENGTH);
    } finally {
      Arrays.fill(passwordBytes, (byte) 0);
    }

    byte[] decrypted;

    try {
      decrypted = decryptBlocks(ciphertext, material);
    } finally {
      material.wipe();
    }

    try {
      return decodeUtf8(decrypted, unpaddedLength(decrypted));
    } finally {
      Arrays.fill(decrypted, (byte) 0);
    }
  }

  /**
   * @param data Decrypted data, length is a positive multiple of the block size
   * @return Length of the data with its PKCS#7 padding removed
   */
  static int unpaddedLength(@NotNull byte[] data) {
    int padLength = data[data.length - 1] & 0xFF;

    if (padLength < 1 || padLength > BLOCK_SIZE) {
      throw new PageResolutionException("Invalid padding length " + padLength + ", wrong password?", CIPHER_FAILED);
    }

    for (int i = data.length - padLength; i < data.length; i++) {
      if ((data[i] & 0xFF) != padLength) {
        throw new PageResolutionException("Padding bytes do not match padding length " + padLength +
            ", wrong password?", CIPHER_FAILED);
      }
    }

    return data.length - padLength;
  }

  private static byte[] decryptBlocks(byte[] ciphertext, DerivedKeyMaterial material) {
    try {
      Cipher cipher = Cipher.getInstance("AES/CBC/NoPadding");
      cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(material.getKey(), "AES"),
          new IvParameterSpec(material.getIv()));
      return cipher.doFinal(ciphertext);
    } catch (GeneralSecurityException e) {
      throw new PageResolutionException("AES-CBC decryption failed", CIPHER_FAILED, e);
    }
  }

  private static String decodeUtf8(byte[] data, int length) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(data, 0, length))
          .toString();
    } catch (CharacterCodingException e) {
      throw new PageResolutionException("Decrypted payload is not valid UTF-8", DECODE_FAILED, e);
    }
  }
}
