package dev.mangaloader.batoto.page;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * One resolved image of a chapter.
 */
public class ChapterPage {
  public final String id;
  public final String url;

  public ChapterPage(@NotNull String id, @NotNull String url) {
    this.id = id;
    this.url = url;
  }

  /**
   * @param url Final image URL
   * @return Page whose id is the hex SHA-1 of its URL, stable across resolutions
   */
  @NotNull
  public static ChapterPage forUrl(@NotNull String url) {
    return new ChapterPage(sha1Hex(url), url);
  }

  private static String sha1Hex(String text) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-1").digest(text.getBytes(StandardCharsets.UTF_8));
      StringBuilder builder = new StringBuilder(digest.length * 2);

      for (byte b : digest) {
        builder.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
      }

      return builder.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 is not available", e);
    }
  }

  @Override
  public String toString() {
    return url;
  }
}
