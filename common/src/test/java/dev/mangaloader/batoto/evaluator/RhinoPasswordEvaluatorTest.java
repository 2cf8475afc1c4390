package dev.mangaloader.batoto.evaluator;

import dev.mangaloader.batoto.PageResolutionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.EVALUATOR_FAILED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class RhinoPasswordEvaluatorTest {
  private final RhinoPasswordEvaluator evaluator = new RhinoPasswordEvaluator();

  @Test
  void evaluatesStringExpressions() {
    assertEquals("s3cret", evaluator.evaluate("['s','3','c','r','e','t'].join('')"));
    assertEquals("10", evaluator.evaluate("(+!![] + []) + (+[])"));
    assertEquals("ab", evaluator.evaluate("'a' + 'b';"));
  }

  @Test
  void rejectsNonStringResults() {
    assertFailure(evaluator, "1 + 1");
    assertFailure(evaluator, "undefined");
    assertFailure(evaluator, "null");
  }

  @Test
  void rejectsEmptyString() {
    assertFailure(evaluator, "''");
  }

  @Test
  void rejectsScriptErrors() {
    assertFailure(evaluator, "'abc");
    assertFailure(evaluator, "notDefined + 'x'");
    assertFailure(evaluator, "(function() { throw 'nope'; })()");
  }

  @Test
  void hasNoJavaAccess() {
    assertFailure(evaluator, "String(java.lang.System.getProperty('user.home'))");
  }

  @Test
  void stopsRunawayExpressions() {
    RhinoPasswordEvaluator quick = new RhinoPasswordEvaluator(200, TimeUnit.MILLISECONDS);

    assertTimeoutPreemptively(Duration.ofSeconds(10),
        () -> assertFailure(quick, "(function() { while (true) {} })()"));
  }

  @Test
  void stopsDeepRecursion() {
    assertFailure(evaluator, "(function f(n) { return f(n + 1) + ''; })(0)");
  }

  @Test
  void scopeIsNotSharedBetweenCalls() {
    assertEquals("x", evaluator.evaluate("var leaked = 'x'; leaked"));
    assertFailure(evaluator, "leaked");
  }

  private static void assertFailure(PasswordEvaluator evaluator, String expression) {
    PageResolutionException e = assertThrows(PageResolutionException.class, () -> evaluator.evaluate(expression));
    assertEquals(EVALUATOR_FAILED, e.getFailureType());
  }
}
