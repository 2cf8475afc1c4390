package dev.mangaloader.batoto.evaluator;

import dev.mangaloader.batoto.PageResolutionException;
import org.jetbrains.annotations.NotNull;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Scriptable;

import java.util.concurrent.TimeUnit;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.EVALUATOR_FAILED;

/**
 * Evaluates password expressions with Mozilla Rhino. Each call gets a fresh scope with only the safe standard objects,
 * so scripts have no access to Java classes. The interpreter checks the deadline every few thousand instructions on
 * the calling thread, which stops runaway expressions without leaving a worker thread behind.
 */
public class RhinoPasswordEvaluator implements PasswordEvaluator {
  public static final long DEFAULT_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(5);

  private static final int INSTRUCTION_OBSERVER_THRESHOLD = 10_000;
  private static final int MAXIMUM_STACK_DEPTH = 1_000;
  private static final Object DEADLINE_KEY = new Object();

  private final ContextFactory contextFactory;
  private final long timeoutNanos;

  public RhinoPasswordEvaluator(long timeout, @NotNull TimeUnit unit) {
    if (timeout <= 0) {
      throw new IllegalArgumentException("Timeout must be positive");
    }

    this.contextFactory = new DeadlineContextFactory();
    this.timeoutNanos = unit.toNanos(timeout);
  }

  public RhinoPasswordEvaluator() {
    this(DEFAULT_TIMEOUT_MS, TimeUnit.MILLISECONDS);
  }

  @NotNull
  @Override
  public String evaluate(@NotNull String expression) {
    Context context = contextFactory.enterContext();

    try {
      context.putThreadLocal(DEADLINE_KEY, System.nanoTime() + timeoutNanos);
      Scriptable scope = context.initSafeStandardObjects();
      Object result = context.evaluateString(scope, expression, "batoPass", 1, null);

      if (!(result instanceof CharSequence)) {
        throw new PageResolutionException("Expression evaluated to " + describe(result) + " instead of a string",
            EVALUATOR_FAILED);
      }

      String password = result.toString();

      if (password.isEmpty()) {
        throw new PageResolutionException("Expression evaluated to an empty string", EVALUATOR_FAILED);
      }

      return password;
    } catch (EvaluationTimeoutError e) {
      throw new PageResolutionException("Expression did not finish within " +
          TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + " ms", EVALUATOR_FAILED, e);
    } catch (RhinoException e) {
      throw new PageResolutionException("Expression failed: " + e.details(), EVALUATOR_FAILED, e);
    } finally {
      Context.exit();
    }
  }

  private static String describe(Object result) {
    return result == null ? "null" : "a " + result.getClass().getSimpleName();
  }

  private static class DeadlineContextFactory extends ContextFactory {
    @Override
    protected Context makeContext() {
      Context context = super.makeContext();
      context.setLanguageVersion(Context.VERSION_ES6);
      // instruction observation and stack depth limits only work in interpreted mode
      context.setOptimizationLevel(-1);
      context.setMaximumInterpreterStackDepth(MAXIMUM_STACK_DEPTH);
      context.setInstructionObserverThreshold(INSTRUCTION_OBSERVER_THRESHOLD);
      return context;
    }

    @Override
    protected void observeInstructionCount(Context context, int instructionCount) {
      Object deadline = context.getThreadLocal(DEADLINE_KEY);

      if (deadline instanceof Long && System.nanoTime() - (Long) deadline > 0) {
        throw new EvaluationTimeoutError();
      }
    }
  }

  private static class EvaluationTimeoutError extends Error {
    private EvaluationTimeoutError() {
      super("Evaluation deadline exceeded", null, false, false);
    }
  }
}
