package dev.mangaloader.batoto.page;

import org.jetbrains.annotations.NotNull;

import java.util.regex.Pattern;

/**
 * Site markup constants used to find the encrypted page list of a chapter. When the site changes its chapter page
 * script, only this needs to change. Each literal pattern must capture the literal in its first group.
 */
@SuppressWarnings("RegExpRedundantEscape")
public final class PageScriptFormat {
  private static final Pattern DEFAULT_SCRIPT_BLOCK_PATTERN = Pattern.compile(
      "<script\\b[^>]*>(.*?)</script\\s*>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

  public static final PageScriptFormat DEFAULT = builder().build();

  public final Pattern scriptBlockPattern;
  public final String locatorMarker;
  public final Pattern baseUrlsPattern;
  public final Pattern passwordExpressionPattern;
  public final Pattern encodedWordPattern;

  private PageScriptFormat(Builder builder) {
    this.scriptBlockPattern = builder.scriptBlockPattern;
    this.locatorMarker = builder.locatorMarker;
    this.baseUrlsPattern = builder.baseUrlsPattern;
    this.passwordExpressionPattern = builder.passwordExpressionPattern;
    this.encodedWordPattern = builder.encodedWordPattern;
  }

  @NotNull
  public static Builder builder() {
    return new Builder();
  }

  @NotNull
  public Builder toBuilder() {
    return new Builder()
        .withScriptBlockPattern(scriptBlockPattern)
        .withLocatorMarker(locatorMarker)
        .withBaseUrlsPattern(baseUrlsPattern)
        .withPasswordExpressionPattern(passwordExpressionPattern)
        .withEncodedWordPattern(encodedWordPattern);
  }

  public static class Builder {
    private Pattern scriptBlockPattern = DEFAULT_SCRIPT_BLOCK_PATTERN;
    private String locatorMarker = "const imgHttps =";
    private Pattern baseUrlsPattern = Pattern.compile("const\\s+imgHttps\\s*=\\s*(\\[[^\\]]*\\])", Pattern.DOTALL);
    private Pattern passwordExpressionPattern = Pattern.compile("batoPass\\s*=\\s*([^;]+);");
    private Pattern encodedWordPattern = Pattern.compile("batoWord\\s*=\\s*([\"'`][^;]*[\"'`])\\s*;");

    public Builder withScriptBlockPattern(@NotNull Pattern scriptBlockPattern) {
      this.scriptBlockPattern = scriptBlockPattern;
      return this;
    }

    public Builder withLocatorMarker(@NotNull String locatorMarker) {
      this.locatorMarker = locatorMarker;
      return this;
    }

    public Builder withBaseUrlsPattern(@NotNull Pattern baseUrlsPattern) {
      this.baseUrlsPattern = baseUrlsPattern;
      return this;
    }

    public Builder withPasswordExpressionPattern(@NotNull Pattern passwordExpressionPattern) {
      this.passwordExpressionPattern = passwordExpressionPattern;
      return this;
    }

    public Builder withEncodedWordPattern(@NotNull Pattern encodedWordPattern) {
      this.encodedWordPattern = encodedWordPattern;
      return this;
    }

    public PageScriptFormat build() {
      return new PageScriptFormat(this);
    }
  }
}
