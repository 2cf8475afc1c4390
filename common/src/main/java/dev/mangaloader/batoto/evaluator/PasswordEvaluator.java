package dev.mangaloader.batoto.evaluator;

import org.jetbrains.annotations.NotNull;

/**
 * Evaluates the site controlled expression that yields the page list password.
 */
public interface PasswordEvaluator {
  /**
   * @param expression Expression text exactly as found in the page script
   * @return The non-empty password the expression evaluates to
   * @throws dev.mangaloader.batoto.PageResolutionException with
   *         {@link dev.mangaloader.batoto.PageResolutionException.FailureType#EVALUATOR_FAILED} on any failure,
   *         including timeouts and results that are not non-empty strings
   */
  @NotNull
  String evaluate(@NotNull String expression);
}
