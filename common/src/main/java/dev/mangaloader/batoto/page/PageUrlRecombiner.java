package dev.mangaloader.batoto.page;

import com.sedmelluq.discord.lavaplayer.tools.DataFormatTools;
import dev.mangaloader.batoto.PageResolutionException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.DECODE_FAILED;
import static dev.mangaloader.batoto.PageResolutionException.FailureType.LENGTH_MISMATCH;

/**
 * Joins base image URLs with their decrypted query fragments by position.
 */
public final class PageUrlRecombiner {
  private PageUrlRecombiner() {
  }

  /**
   * @param plaintext Decrypted payload, a JSON array of strings
   * @return The query fragments, possibly empty
   */
  @NotNull
  public static List<String> parseFragments(@NotNull String plaintext) {
    return JsonStringArrays.parse(plaintext, "Decrypted payload", DECODE_FAILED);
  }

  /**
   * @param baseUrls  Base URLs in page order
   * @param fragments Query fragments, either empty or one per base URL
   * @return Final URLs in the order of the base URLs
   */
  @NotNull
  public static List<String> recombine(@NotNull List<String> baseUrls, @NotNull List<String> fragments) {
    if (!fragments.isEmpty() && fragments.size() != baseUrls.size()) {
      throw new PageResolutionException("Got " + fragments.size() + " fragments for " + baseUrls.size() +
          " base URLs", LENGTH_MISMATCH);
    }

    List<String> urls = new ArrayList<>(baseUrls.size());

    for (int i = 0; i < baseUrls.size(); i++) {
      String fragment = fragments.isEmpty() ? null : fragments.get(i);
      urls.add(DataFormatTools.isNullOrEmpty(fragment) ? baseUrls.get(i) : baseUrls.get(i) + "?" + fragment);
    }

    return urls;
  }
}
