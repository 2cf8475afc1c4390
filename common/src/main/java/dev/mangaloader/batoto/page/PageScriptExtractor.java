package dev.mangaloader.batoto.page;

import com.sedmelluq.discord.lavaplayer.tools.DataFormatTools;
import dev.mangaloader.batoto.PageResolutionException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.EXTRACTION_FAILED;

/**
 * Finds the inline chapter script of a page and pulls out the base image URLs, the password expression and the
 * encrypted word. Scripts that carry the locator marker but miss one of the literals are skipped in favour of later
 * ones; if no script yields all three, the most specific reason seen is reported.
 */
public class PageScriptExtractor {
  private static final Logger log = LoggerFactory.getLogger(PageScriptExtractor.class);

  private final PageScriptFormat format;

  public PageScriptExtractor(@NotNull PageScriptFormat format) {
    this.format = format;
  }

  public PageScriptExtractor() {
    this(PageScriptFormat.DEFAULT);
  }

  /**
   * @param pageText Full markup of a chapter page, or the bare script text if it has no script elements
   * @return Extracted literals, the password expression is kept as unparsed text
   */
  @NotNull
  public PageScriptArtifacts extract(@NotNull String pageText) {
    String failure = "script block containing '" + format.locatorMarker + "'";

    for (String block : findScriptBlocks(pageText)) {
      if (!block.contains(format.locatorMarker)) {
        continue;
      }

      String baseUrlsLiteral = findLiteral(block, format.baseUrlsPattern);

      if (baseUrlsLiteral == null) {
        failure = "base URL array literal";
        log.warn("Skipping script block with locator marker but no base URL array literal");
        continue;
      }

      String passwordExpression = findLiteral(block, format.passwordExpressionPattern);

      if (DataFormatTools.isNullOrEmpty(passwordExpression)) {
        failure = "password expression";
        log.warn("Skipping script block with locator marker but no password expression");
        continue;
      }

      String encodedWord = stripQuotes(findLiteral(block, format.encodedWordPattern));

      if (DataFormatTools.isNullOrEmpty(encodedWord)) {
        failure = "encoded word literal";
        log.warn("Skipping script block with locator marker but no encoded word literal");
        continue;
      }

      List<String> baseUrls = parseBaseUrls(baseUrlsLiteral);
      log.debug("Extracted {} base URLs from chapter page script", baseUrls.size());

      return new PageScriptArtifacts(baseUrls, passwordExpression, encodedWord);
    }

    throw new PageResolutionException("Must find " + failure + " in chapter page", EXTRACTION_FAILED);
  }

  private List<String> findScriptBlocks(String pageText) {
    Matcher matcher = format.scriptBlockPattern.matcher(pageText);
    List<String> blocks = new ArrayList<>();

    while (matcher.find()) {
      blocks.add(matcher.group(1));
    }

    return blocks.isEmpty() ? Collections.singletonList(pageText) : blocks;
  }

  private static String findLiteral(String block, Pattern pattern) {
    Matcher matcher = pattern.matcher(block);
    return matcher.find() ? matcher.group(1).trim() : null;
  }

  private static String stripQuotes(String literal) {
    if (literal == null) {
      return null;
    }

    int start = 0;
    int end = literal.length();

    while (start < end && isQuote(literal.charAt(start))) {
      start++;
    }

    while (end > start && isQuote(literal.charAt(end - 1))) {
      end--;
    }

    return literal.substring(start, end);
  }

  private static boolean isQuote(char c) {
    return c == '"' || c == '\'' || c == '`';
  }

  private static List<String> parseBaseUrls(String literal) {
    return JsonStringArrays.parse(literal, "Base URL array literal", EXTRACTION_FAILED);
  }
}
