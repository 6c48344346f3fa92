package com.github.behaviorengine.expression;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.github.behaviorengine.BehaviorEngineException;

/**
 * Value produced by {@code ["fn", param, body]} or {@code ["fn", [params...], body]}. Closes over
 * the context it was created in.
 */
public final class Lambda {
  private final List<String> params;
  private final Expression body;
  private final Evaluator evaluator;
  private final EvaluationContext closure;

  Lambda(final List<String> params, final Expression body, final Evaluator evaluator,
      final EvaluationContext closure) {
    this.params = Collections.unmodifiableList(params);
    this.body = body;
    this.evaluator = evaluator;
    this.closure = closure;
  }

  /**
   * With several params a list argument is spread across them; a scalar binds the first param.
   */
  public Object invoke(final Object argument) throws BehaviorEngineException {
    final Map<String, Object> locals = new HashMap<>();
    if (params.size() == 1) {
      locals.put(params.get(0), argument);
    } else {
      final List<Object> spread = Coercions.toList(argument);
      for (int iter = 0; iter < params.size(); iter++) {
        locals.put(params.get(iter), iter < spread.size() ? spread.get(iter) : Undefined.INSTANCE);
      }
    }
    return evaluator.evaluate(body, closure.child(locals));
  }

  public List<String> getParams() {
    return params;
  }

  @Override
  public String toString() {
    return "Lambda [params=" + params + ", body=" + body + "]";
  }
}
