package dev.mangaloader.batoto.cipher;

import dev.mangaloader.batoto.PageResolutionException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.CIPHER_FAILED;
import static dev.mangaloader.batoto.PageResolutionException.FailureType.DECODE_FAILED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PayloadDecryptorTest {
  @Test
  void decryptsOpensslCompatiblePayload() {
    SaltedPayload payload = SaltedPayload.decode("U2FsdGVkX18BAgMEBQYHCP88/hAp9e/iRcKRnVNJM3g=");

    assertEquals("[\"x=1\",\"\"]", PayloadDecryptor.decrypt(payload, "s3cret"));
  }

  @Test
  void roundTripsMultiBlockUnicodeText() throws Exception {
    String plaintext = "[\"acc=été&exp=1700000000\",\"\",\"sig=猫\"]";
    SaltedPayload payload = SaltedPayload.decode(SaltedPayloads.encrypt(plaintext, "pässword"));

    assertEquals(plaintext, PayloadDecryptor.decrypt(payload, "pässword"));
  }

  @Test
  void roundTripsBlockAlignedPlaintext() throws Exception {
    String plaintext = "0123456789abcdef";
    SaltedPayload payload = SaltedPayload.decode(SaltedPayloads.encrypt(plaintext, "pw"));

    assertEquals(32, payload.getCiphertext().length);
    assertEquals(plaintext, PayloadDecryptor.decrypt(payload, "pw"));
  }

  @Test
  void wrongPasswordFailsPaddingCheck() {
    SaltedPayload payload = SaltedPayload.decode("U2FsdGVkX18BAgMEBQYHCP88/hAp9e/iRcKRnVNJM3g=");

    PageResolutionException e = assertThrows(PageResolutionException.class,
        () -> PayloadDecryptor.decrypt(payload, "wrong"));

    assertEquals(CIPHER_FAILED, e.getFailureType());
  }

  @Test
  void rejectsUnalignedCiphertext() throws Exception {
    byte[] raw = SaltedPayloads.encryptRaw("[]", "pw", SaltedPayloads.SALT);
    SaltedPayload payload = SaltedPayload.fromBytes(Arrays.copyOf(raw, raw.length - 1));

    PageResolutionException e = assertThrows(PageResolutionException.class,
        () -> PayloadDecryptor.decrypt(payload, "pw"));

    assertEquals(CIPHER_FAILED, e.getFailureType());
  }

  @Test
  void rejectsEmptyCiphertext() {
    SaltedPayload payload = SaltedPayload.fromBytes(concat("Salted__".getBytes(StandardCharsets.US_ASCII),
        SaltedPayloads.SALT));

    PageResolutionException e = assertThrows(PageResolutionException.class,
        () -> PayloadDecryptor.decrypt(payload, "pw"));

    assertEquals(CIPHER_FAILED, e.getFailureType());
  }

  @Test
  void unpaddingChecksEveryPadByte() {
    byte[] valid = new byte[16];
    Arrays.fill(valid, 12, 16, (byte) 4);
    assertEquals(12, PayloadDecryptor.unpaddedLength(valid));

    byte[] fullBlock = new byte[32];
    Arrays.fill(fullBlock, 16, 32, (byte) 16);
    assertEquals(16, PayloadDecryptor.unpaddedLength(fullBlock));

    byte[] mismatched = valid.clone();
    mismatched[13] = 3;
    assertCipherFailure(mismatched);

    byte[] zero = new byte[16];
    assertCipherFailure(zero);

    byte[] tooLong = new byte[16];
    tooLong[15] = 17;
    assertCipherFailure(tooLong);
  }

  @Test
  void rejectsInvalidUtf8Plaintext() throws Exception {
    byte[] garbage = {(byte) 0xC3, (byte) 0x28, 0x41};
    byte[] raw = SaltedPayloads.encryptRaw(garbage, "pw", SaltedPayloads.SALT);

    PageResolutionException e = assertThrows(PageResolutionException.class,
        () -> PayloadDecryptor.decrypt(SaltedPayload.fromBytes(raw), "pw"));

    assertEquals(DECODE_FAILED, e.getFailureType());
  }

  private static void assertCipherFailure(byte[] data) {
    PageResolutionException e = assertThrows(PageResolutionException.class,
        () -> PayloadDecryptor.unpaddedLength(data));

    assertEquals(CIPHER_FAILED, e.getFailureType());
  }

  private static byte[] concat(byte[] first, byte[] second) {
    byte[] result = Arrays.copyOf(first, first.length + second.length);
    System.arraycopy(second, 0, result, first.length, second.length);
    return result;
  }
}
