package dev.mangaloader.batoto.page;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * The three literals pulled out of a chapter page script.
 */
public class PageScriptArtifacts {
  public final List<String> baseUrls;
  public final String passwordExpression;
  public final String encodedWord;

  public PageScriptArtifacts(@NotNull List<String> baseUrls, @NotNull String passwordExpression,
                             @NotNull String encodedWord) {
    this.baseUrls = Collections.unmodifiableList(baseUrls);
    this.passwordExpression = passwordExpression;
    this.encodedWord = encodedWord;
  }
}
