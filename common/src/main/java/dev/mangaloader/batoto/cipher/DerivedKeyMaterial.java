package dev.mangaloader.batoto.cipher;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Key and IV derived for a single decrypt call. Instances are wiped once the call that created them returns and are
 * never shared, cached or printed.
 */
public final class DerivedKeyMaterial {
  private final byte[] key;
  private final byte[] iv;

  DerivedKeyMaterial(@NotNull byte[] key, @NotNull byte[] iv) {
    this.key = key;
    this.iv = iv;
  }

  @NotNull
  public byte[] getKey() {
    return key;
  }

  @NotNull
  public byte[] getIv() {
    return iv;
  }

  /**
   * Overwrites the key and IV with zeroes.
   */
  public void wipe() {
    Arrays.fill(key, (byte) 0);
    Arrays.fill(iv, (byte) 0);
  }

  @Override
  public String toString() {
    return "DerivedKeyMaterial[key=" + key.length + " bytes, iv=" + iv.length + " bytes]";
  }
}
