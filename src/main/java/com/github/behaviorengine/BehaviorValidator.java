package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.behaviorengine.affinity.ActionAffinityMatrix;
import com.github.behaviorengine.affinity.ItemAction;
import com.github.behaviorengine.expression.Expression;
import com.github.behaviorengine.expression.Expression.Call;
import com.github.behaviorengine.expression.Expression.Literal;
import com.github.behaviorengine.expression.Expression.Reference;
import com.github.behaviorengine.expression.Operator;
import com.github.behaviorengine.expression.OperatorRegistry;

/**
 * Static checks over a {@link BehaviorDefinition}. Every validator is independent, never throws
 * and returns the complete list of problems it found (empty when the definition is fine).
 */
public final class BehaviorValidator {
  private static final List<String> actionListKeys =
      Arrays.asList("actions", "itemActions", "bulkActions", "headerActions");

  /**
   * Identity, category and basic state machine shape.
   */
  public static List<String> validateStructure(final BehaviorDefinition definition) {
    final List<String> errors = new ArrayList<>();
    final String name = definition.getName();
    if (name == null || name.trim().isEmpty()) {
      errors.add("Behavior must have a name");
    } else if (!name.startsWith(BehaviorDefinition.NAMESPACE)) {
      errors.add("Behavior name should start with 'std/' (got: " + name + ")");
    }
    final String category = definition.getCategoryId();
    if (category == null || category.isEmpty()) {
      errors.add("Behavior must have a category");
    } else if (BehaviorCategory.fromId(category) == null) {
      errors.add("Invalid category: " + category);
    }
    final StateMachineSpec machine = definition.getStateMachine();
    if (machine != null) {
      if (machine.getStates().isEmpty()) {
        errors.add("State machine must have at least one state");
      }
      for (final State state : machine.getStates()) {
        if (state.getName() == null || state.getName().isEmpty()) {
          errors.add("State must have a name");
        }
      }
      if (machine.getInitial() == null || machine.getInitial().isEmpty()) {
        errors.add("State machine must have an initial state");
      } else if (!machine.getStates().isEmpty() && !machine.hasState(machine.getInitial())) {
        errors.add("Initial state is not declared: " + machine.getInitial());
      }
    }
    return errors;
  }

  /**
   * Every transition event is declared. Each undeclared event is reported once.
   */
  public static List<String> validateEvents(final BehaviorDefinition definition) {
    final List<String> errors = new ArrayList<>();
    final StateMachineSpec machine = definition.getStateMachine();
    if (machine == null) {
      return errors;
    }
    final Set<String> declared = machine.getEventKeys();
    final Set<String> reported = new LinkedHashSet<>();
    for (final Transition transition : machine.getTransitions()) {
      final String event = transition.getEvent();
      if (event == null || event.isEmpty()) {
        errors.add("Transition must have an event");
      } else if (!declared.contains(event) && reported.add(event)) {
        errors.add("Transition uses undeclared event: " + event);
      }
    }
    return errors;
  }

  /**
   * Every transition source and target is declared, wildcard excepted.
   */
  public static List<String> validateStates(final BehaviorDefinition definition) {
    final List<String> errors = new ArrayList<>();
    final StateMachineSpec machine = definition.getStateMachine();
    if (machine == null) {
      return errors;
    }
    final Set<String> declared = machine.getStateNames();
    for (final Transition transition : machine.getTransitions()) {
      if (!transition.isWildcard()) {
        for (final String from : transition.getFrom()) {
          if (!declared.contains(from)) {
            errors.add("Transition from undeclared state: " + from);
          }
        }
      }
      if (transition.getTo() != null && !declared.contains(transition.getTo())) {
        errors.add("Transition to undeclared state: " + transition.getTo());
      }
    }
    return errors;
  }

  /**
   * Unknown operators, arity violations, lambdas where none are accepted, and guards that use
   * effect operators. Covers transition, tick and listener guards, and every effect list.
   */
  public static List<String> validateExpressions(final BehaviorDefinition definition,
      final OperatorRegistry operators) {
    final List<String> errors = new ArrayList<>();
    final StateMachineSpec machine = definition.getStateMachine();
    if (machine != null) {
      for (final Transition transition : machine.getTransitions()) {
        final String where = describe(transition);
        checkExpression(transition.getGuard(), where + " guard", true, operators, errors);
        checkEffects(transition.getEffects(), where, operators, errors);
      }
    }
    for (final Tick tick : definition.getTicks()) {
      final String where = "tick '" + tick.getName() + "'";
      checkExpression(tick.getGuard(), where + " guard", true, operators, errors);
      checkEffects(tick.getEffects(), where, operators, errors);
    }
    for (final Listener listener : definition.getListens()) {
      checkExpression(listener.getGuard(), "listener '" + listener.getEvent() + "' guard", true,
          operators, errors);
    }
    checkEffects(definition.getInitialEffects(), "initial", operators, errors);
    return errors;
  }

  /**
   * Actions attached to rendered components must be legal for the component type. These are
   * authoring findings; they do not make a definition unusable.
   */
  public static List<String> validateActionAffinity(final BehaviorDefinition definition,
      final ActionAffinityMatrix matrix) {
    final List<String> errors = new ArrayList<>();
    final StateMachineSpec machine = definition.getStateMachine();
    if (machine != null) {
      for (final Transition transition : machine.getTransitions()) {
        for (final Expression effect : transition.getEffects()) {
          collectAffinityErrors(effect, describe(transition), matrix, errors);
        }
      }
    }
    for (final Tick tick : definition.getTicks()) {
      for (final Expression effect : tick.getEffects()) {
        collectAffinityErrors(effect, "tick '" + tick.getName() + "'", matrix, errors);
      }
    }
    for (final Expression effect : definition.getInitialEffects()) {
      collectAffinityErrors(effect, "initial effects", matrix, errors);
    }
    return errors;
  }

  /**
   * All checks that keep a definition out of a registry.
   */
  public static List<String> validateAll(final BehaviorDefinition definition,
      final OperatorRegistry operators) {
    final List<String> errors = new ArrayList<>();
    errors.addAll(validateStructure(definition));
    errors.addAll(validateEvents(definition));
    errors.addAll(validateStates(definition));
    errors.addAll(validateExpressions(definition, operators));
    return errors;
  }

  static String describe(final Transition transition) {
    return "transition " + (transition.isWildcard() ? Transition.ANY_STATE : transition.getFrom())
        + " -[" + transition.getEvent() + "]-> "
        + (transition.isSelfLoop() ? "(self)" : transition.getTo());
  }

  private static void checkEffects(final List<Expression> effects, final String where,
      final OperatorRegistry operators, final List<String> errors) {
    for (int iter = 0; iter < effects.size(); iter++) {
      checkExpression(effects.get(iter), where + " effect #" + (iter + 1), false, operators,
          errors);
    }
  }

  private static void checkExpression(final Expression expression, final String where,
      final boolean pureOnly, final OperatorRegistry operators, final List<String> errors) {
    if (expression == null) {
      return;
    }
    if (expression instanceof Literal) {
      final Literal literal = (Literal) expression;
      for (final Expression member : literal.getMembers().values()) {
        checkExpression(member, where, pureOnly, operators, errors);
      }
      for (final Expression element : literal.getElements()) {
        checkExpression(element, where, pureOnly, operators, errors);
      }
      return;
    }
    if (expression instanceof Reference) {
      return;
    }
    final Call call = (Call) expression;
    final String name = call.getOperator();
    final Operator operator = operators.lookup(name);
    if (pureOnly && operators.isEffectOperator(name)) {
      errors.add(String.format("Effect operator '%s' is not allowed in %s", name, where));
    }
    if (operator == null) {
      if (!operators.isEffectOperator(name)) {
        errors.add(String.format("Unknown operator '%s' in %s", name, where));
      }
    } else {
      if (!operator.acceptsArity(call.arity())) {
        errors.add(String.format("Operator '%s' expects %s arguments, got %d in %s", name,
            operator.describeArity(), call.arity(), where));
      }
      if (!operator.acceptsLambda() && !operator.isLazy()) {
        for (final Expression arg : call.getArgs()) {
          if (arg instanceof Call && "fn".equals(((Call) arg).getOperator())) {
            errors.add(String.format("Operator '%s' does not accept a lambda in %s", name, where));
          }
        }
      }
    }
    for (final Expression arg : call.getArgs()) {
      checkExpression(arg, where, pureOnly, operators, errors);
    }
  }

  private static void collectAffinityErrors(final Expression expression, final String where,
      final ActionAffinityMatrix matrix, final List<String> errors) {
    if (!(expression instanceof Call)) {
      return;
    }
    final Call call = (Call) expression;
    final boolean render =
        "render-ui".equals(call.getOperator()) || "render".equals(call.getOperator());
    if (render && call.arity() >= 2) {
      final Expression pattern = call.getArgs().get(1);
      String component = null;
      final List<ItemAction> actions = new ArrayList<>();
      if (pattern instanceof Literal && ((Literal) pattern).isString()) {
        component = (String) ((Literal) pattern).getValue();
      } else if (pattern instanceof Literal && ((Literal) pattern).isObject()) {
        final Expression type = ((Literal) pattern).getMembers().get("type");
        if (type instanceof Literal && ((Literal) type).isString()) {
          component = (String) ((Literal) type).getValue();
        }
        collectActions(((Literal) pattern).getMembers(), actions);
      }
      if (call.arity() >= 3 && call.getArgs().get(2) instanceof Literal) {
        collectActions(((Literal) call.getArgs().get(2)).getMembers(), actions);
      }
      if (component != null) {
        for (final String error : matrix.validateActionsForComponent(actions, component)) {
          errors.add(where + ": " + error);
        }
      }
    }
    // render calls may sit inside when/do/if or timer effects
    for (final Expression arg : call.getArgs()) {
      collectAffinityErrors(arg, where, matrix, errors);
    }
  }

  private static void collectActions(final Map<String, Expression> props,
      final List<ItemAction> actions) {
    for (final String key : actionListKeys) {
      final Expression list = props.get(key);
      if (!(list instanceof Literal)) {
        continue;
      }
      for (final Expression element : ((Literal) list).getElements()) {
        final ItemAction action = actionOf(element);
        if (action != null) {
          actions.add(action);
        }
      }
    }
  }

  private static ItemAction actionOf(final Expression element) {
    if (!(element instanceof Literal)) {
      return null;
    }
    final Literal literal = (Literal) element;
    if (literal.isString()) {
      return ItemAction.forEvent((String) literal.getValue());
    }
    if (!literal.isObject()) {
      return null;
    }
    final Map<String, Expression> members = literal.getMembers();
    return new ItemAction(text(members.get("label")), text(members.get("event")),
        text(members.get("navigatesTo")), text(members.get("placement")),
        text(members.get("variant")));
  }

  private static String text(final Expression expression) {
    if (expression instanceof Literal && ((Literal) expression).isString()) {
      return (String) ((Literal) expression).getValue();
    }
    return null;
  }

  private BehaviorValidator() {}
}
