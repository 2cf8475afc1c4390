package dev.mangaloader.batoto.evaluator;

import dev.mangaloader.batoto.PageResolutionException;
import org.jetbrains.annotations.NotNull;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.EVALUATOR_FAILED;

/**
 * Evaluates expressions that are a quoted string literal or a {@code +} concatenation of them, without a script
 * engine. Escape sequences are not supported, expressions using them are rejected.
 */
public class StringLiteralPasswordEvaluator implements PasswordEvaluator {
  private static final String LITERAL = "(?:\"([^\"\\\\]*)\"|'([^'\\\\]*)')";
  private static final Pattern LITERAL_PATTERN = Pattern.compile(LITERAL);
  private static final Pattern CONCATENATION_PATTERN = Pattern.compile(
      "\\s*\\(?\\s*" + LITERAL + "(?:\\s*\\+\\s*" + LITERAL + ")*\\s*\\)?\\s*;?\\s*");

  @NotNull
  @Override
  public String evaluate(@NotNull String expression) {
    if (!CONCATENATION_PATTERN.matcher(expression).matches()) {
      throw new PageResolutionException("Expression is not a string literal concatenation", EVALUATOR_FAILED);
    }

    StringBuilder password = new StringBuilder();
    Matcher matcher = LITERAL_PATTERN.matcher(expression);

    while (matcher.find()) {
      password.append(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
    }

    if (password.length() == 0) {
      throw new PageResolutionException("Expression evaluated to an empty string", EVALUATOR_FAILED);
    }

    return password.toString();
  }
}
