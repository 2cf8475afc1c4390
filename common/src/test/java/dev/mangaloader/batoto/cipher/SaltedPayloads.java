package dev.mangaloader.batoto.cipher;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Builds salted payloads the way {@code openssl enc -aes-256-cbc -md md5} does.
 */
public final class SaltedPayloads {
  public static final byte[] SALT = {1, 2, 3, 4, 5, 6, 7, 8};

  private SaltedPayloads() {
  }

  public static byte[] encryptRaw(String plaintext, String password, byte[] salt) throws Exception {
    return encryptRaw(plaintext.getBytes(StandardCharsets.UTF_8), password, salt);
  }

  public static byte[] encryptRaw(byte[] plaintext, String password, byte[] salt) throws Exception {
    DerivedKeyMaterial material = EvpKeyDeriver.derive(password.getBytes(StandardCharsets.UTF_8), salt,
        PayloadDecryptor.KEY_LENGTH, PayloadDecryptor.IV_LENGTH);

    Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
    cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(material.getKey(), "AES"),
        new IvParameterSpec(material.getIv()));

    ByteArrayOutputStream output = new ByteArrayOutputStream();
    output.write("Salted__".getBytes(StandardCharsets.US_ASCII));
    output.write(salt);
    output.write(cipher.doFinal(plaintext));
    return output.toByteArray();
  }

  public static String encrypt(String plaintext, String password) throws Exception {
    return Base64.getEncoder().encodeToString(encryptRaw(plaintext, password, SALT));
  }
}
