package com.github.behaviorengine.expression;

import java.util.List;

import com.github.behaviorengine.BehaviorEngineException;

/**
 * A named, arity-checked function callable from expressions.
 *
 * Eager operators receive their already-evaluated arguments. Lazy operators receive the argument
 * expressions and decide themselves what to evaluate and when; control forms (and, or, if, let,
 * fn) and all effect operators are lazy.
 *
 * Impure operators are effect operators: they are rejected in guards and in any pure context.
 */
public final class Operator {
  public static final int UNBOUNDED = -1;

  private final String name;
  private final int minArity;
  private final int maxArity;
  private final boolean pure;
  private final boolean acceptsLambda;
  private final EagerFunction eager;
  private final LazyFunction lazy;

  @FunctionalInterface
  public interface EagerFunction {
    Object apply(final List<Object> values, final EvaluationContext context)
        throws BehaviorEngineException;
  }

  @FunctionalInterface
  public interface LazyFunction {
    Object apply(final Evaluator evaluator, final List<Expression> args,
        final EvaluationContext context) throws BehaviorEngineException;
  }

  private Operator(final String name, final int minArity, final int maxArity, final boolean pure,
      final boolean acceptsLambda, final EagerFunction eager, final LazyFunction lazy) {
    this.name = name;
    this.minArity = minArity;
    this.maxArity = maxArity;
    this.pure = pure;
    this.acceptsLambda = acceptsLambda;
    this.eager = eager;
    this.lazy = lazy;
  }

  public static Operator eager(final String name, final int minArity, final int maxArity,
      final EagerFunction function) {
    return new Operator(name, minArity, maxArity, true, false, function, null);
  }

  /**
   * An eager operator whose arguments may include lambdas built with {@code fn}.
   */
  public static Operator higherOrder(final String name, final int minArity, final int maxArity,
      final EagerFunction function) {
    return new Operator(name, minArity, maxArity, true, true, function, null);
  }

  public static Operator lazy(final String name, final int minArity, final int maxArity,
      final LazyFunction function) {
    return new Operator(name, minArity, maxArity, true, false, null, function);
  }

  public static Operator effect(final String name, final int minArity, final int maxArity,
      final LazyFunction function) {
    return new Operator(name, minArity, maxArity, false, false, null, function);
  }

  public String getName() {
    return name;
  }

  public int getMinArity() {
    return minArity;
  }

  public int getMaxArity() {
    return maxArity;
  }

  public boolean isPure() {
    return pure;
  }

  public boolean acceptsLambda() {
    return acceptsLambda;
  }

  public boolean isLazy() {
    return lazy != null;
  }

  public boolean acceptsArity(final int arity) {
    return arity >= minArity && (maxArity == UNBOUNDED || arity <= maxArity);
  }

  public String describeArity() {
    if (maxArity == UNBOUNDED) {
      return "at least " + minArity;
    }
    if (minArity == maxArity) {
      return String.valueOf(minArity);
    }
    return minArity + " to " + maxArity;
  }

  Object applyEager(final List<Object> values, final EvaluationContext context)
      throws BehaviorEngineException {
    return eager.apply(values, context);
  }

  Object applyLazy(final Evaluator evaluator, final List<Expression> args,
      final EvaluationContext context) throws BehaviorEngineException {
    return lazy.apply(evaluator, args, context);
  }

  @Override
  public String toString() {
    return "Operator [name=" + name + ", arity=" + describeArity() + ", pure=" + pure
        + ", acceptsLambda=" + acceptsLambda + "]";
  }
}
