package com.github.behaviorengine.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.behaviorengine.BehaviorEngineException;
import com.github.behaviorengine.BehaviorEngineException.Code;
import com.github.behaviorengine.expression.Expression.Call;
import com.github.behaviorengine.expression.Expression.Literal;
import com.github.behaviorengine.expression.Expression.Reference;

/**
 * Bottom-up interpreter for {@link Expression} trees. The same evaluator serves guards (pure
 * context, effect operators refused) and effect lists (context carrying {@link Effects}).
 *
 * Evaluators are stateless and thread-safe; all per-evaluation state lives in the context.
 */
public final class Evaluator {
  private final OperatorRegistry operators;

  public Evaluator(final OperatorRegistry operators) {
    this.operators = operators;
  }

  public Object evaluate(final Expression expression, final EvaluationContext context)
      throws BehaviorEngineException {
    return expression.accept(new Evaluation(context));
  }

  /**
   * An absent guard always holds. The guard only ever sees a pure view of the context.
   */
  public boolean evaluateGuard(final Expression guard, final EvaluationContext context)
      throws BehaviorEngineException {
    if (guard == null) {
      return true;
    }
    return Coercions.toBoolean(evaluate(guard, context.pure()));
  }

  /**
   * Runs effects strictly in order. The first failure stops the list; effects already applied
   * stay applied.
   */
  public int executeEffects(final List<Expression> effects, final EvaluationContext context)
      throws BehaviorEngineException {
    int executed = 0;
    for (final Expression effect : effects) {
      evaluate(effect, context);
      executed++;
    }
    return executed;
  }

  public OperatorRegistry getOperators() {
    return operators;
  }

  private final class Evaluation implements Expression.Visitor<Object> {
    private final EvaluationContext context;

    private Evaluation(final EvaluationContext context) {
      this.context = context;
    }

    @Override
    public Object visitLiteral(final Literal literal) throws BehaviorEngineException {
      if (literal.isObject()) {
        final Map<String, Object> value = new LinkedHashMap<>();
        for (final Map.Entry<String, Expression> member : literal.getMembers().entrySet()) {
          value.put(member.getKey(), Coercions.toStored(member.getValue().accept(this)));
        }
        return value;
      }
      if (literal.isList()) {
        final List<Object> value = new ArrayList<>();
        for (final Expression element : literal.getElements()) {
          value.add(Coercions.toStored(element.accept(this)));
        }
        return value;
      }
      return literal.getValue();
    }

    @Override
    public Object visitReference(final Reference reference) {
      return context.resolve(reference);
    }

    @Override
    public Object visitCall(final Call call) throws BehaviorEngineException {
      final Operator operator = operators.lookup(call.getOperator());
      if (operator == null) {
        throw new BehaviorEngineException(Code.UNKNOWN_OPERATOR,
            "Unknown operator: " + call.getOperator());
      }
      if (!operator.acceptsArity(call.arity())) {
        throw new BehaviorEngineException(Code.ARITY_MISMATCH,
            String.format("Operator %s expects %s arguments, got %d", operator.getName(),
                operator.describeArity(), call.arity()));
      }
      if (!operator.isPure() && context.isPure()) {
        throw new BehaviorEngineException(Code.IMPURE_EXPRESSION,
            "Effect operator " + operator.getName() + " cannot run in a pure context");
      }
      if (operator.isLazy()) {
        return operator.applyLazy(Evaluator.this, call.getArgs(), context);
      }
      final List<Object> values = new ArrayList<>(call.arity());
      for (final Expression arg : call.getArgs()) {
        values.add(arg.accept(this));
      }
      return operator.applyEager(values, context);
    }
  }

}
