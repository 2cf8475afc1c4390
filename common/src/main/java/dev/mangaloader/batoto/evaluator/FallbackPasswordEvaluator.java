package dev.mangaloader.batoto.evaluator;

import dev.mangaloader.batoto.PageResolutionException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.EVALUATOR_FAILED;

/**
 * Tries a list of evaluators in order and returns the first password produced.
 */
public class FallbackPasswordEvaluator implements PasswordEvaluator {
  private static final Logger log = LoggerFactory.getLogger(FallbackPasswordEvaluator.class);

  private final List<PasswordEvaluator> evaluators;

  public FallbackPasswordEvaluator(@NotNull List<PasswordEvaluator> evaluators) {
    if (evaluators.isEmpty()) {
      throw new IllegalArgumentException("At least one evaluator is required");
    }

    this.evaluators = new ArrayList<>(evaluators);
  }

  public FallbackPasswordEvaluator(@NotNull PasswordEvaluator... evaluators) {
    this(Arrays.asList(evaluators));
  }

  /**
   * @return Literal matcher first, then a Rhino engine with the default timeout
   */
  @NotNull
  public static FallbackPasswordEvaluator createDefault() {
    return new FallbackPasswordEvaluator(new StringLiteralPasswordEvaluator(), new RhinoPasswordEvaluator());
  }

  @NotNull
  @Override
  public String evaluate(@NotNull String expression) {
    List<String> failures = new ArrayList<>();

    for (PasswordEvaluator evaluator : evaluators) {
      try {
        return evaluator.evaluate(expression);
      } catch (PageResolutionException e) {
        log.debug("Password evaluator {} failed: {}", evaluator.getClass().getSimpleName(), e.getMessage());
        failures.add(evaluator.getClass().getSimpleName() + ": " + e.getMessage());
      }
    }

    log.warn("All {} password evaluators failed for an expression of {} characters", evaluators.size(),
        expression.length());
    throw new PageResolutionException("No evaluator could evaluate the password expression " + failures,
        EVALUATOR_FAILED);
  }
}
