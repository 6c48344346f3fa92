package com.github.behaviorengine.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.behaviorengine.BehaviorEngineException;

/**
 * Closed representation of guard and effect trees. An expression is exactly one of:<br>
 * 1. {@link Literal}: a scalar, or an object/list literal whose members are expressions<br>
 * 2. {@link Reference}: a context binding such as {@code @entity.count}<br>
 * 3. {@link Call}: an operator applied to argument expressions<br>
 *
 * The constructor is package-private, so no other variants can exist; use the {@link Visitor} for
 * exhaustive handling.
 */
public abstract class Expression {

  Expression() {}

  public abstract <R> R accept(final Visitor<R> visitor) throws BehaviorEngineException;

  /**
   * Converts back to the plain JSON-like form this expression was parsed from.
   */
  public abstract Object toData();

  public static Literal literal(final Object scalar) {
    return new Literal(scalar);
  }

  public static Reference reference(final String binding) {
    return Reference.parse(binding);
  }

  public static Call call(final String operator, final Expression... args) {
    return new Call(operator, Arrays.asList(args));
  }

  public static Call call(final String operator, final List<Expression> args) {
    return new Call(operator, args);
  }

  public interface Visitor<R> {
    R visitLiteral(final Literal literal) throws BehaviorEngineException;

    R visitReference(final Reference reference) throws BehaviorEngineException;

    R visitCall(final Call call) throws BehaviorEngineException;
  }

  public static final class Literal extends Expression {
    public static final Literal NULL = new Literal(null);

    // one of: null, String, Number, Boolean, the members map or the elements list
    private final Object value;
    private final Map<String, Expression> members;
    private final List<Expression> elements;

    private Literal(final Object value) {
      this(value, null, null);
    }

    private Literal(final Object value, final Map<String, Expression> members,
        final List<Expression> elements) {
      this.value = value;
      this.members = members;
      this.elements = elements;
    }

    public static Literal object(final Map<String, Expression> members) {
      final Map<String, Expression> copy =
          Collections.unmodifiableMap(new LinkedHashMap<>(members));
      return new Literal(copy, copy, null);
    }

    public static Literal list(final List<Expression> elements) {
      final List<Expression> copy = Collections.unmodifiableList(new ArrayList<>(elements));
      return new Literal(copy, null, copy);
    }

    public Object getValue() {
      return value;
    }

    public boolean isObject() {
      return members != null;
    }

    public boolean isList() {
      return elements != null;
    }

    public boolean isString() {
      return value instanceof String;
    }

    public Map<String, Expression> getMembers() {
      return isObject() ? members : Collections.<String, Expression>emptyMap();
    }

    public List<Expression> getElements() {
      return isList() ? elements : Collections.<Expression>emptyList();
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws BehaviorEngineException {
      return visitor.visitLiteral(this);
    }

    @Override
    public Object toData() {
      if (isObject()) {
        final Map<String, Object> data = new LinkedHashMap<>();
        for (final Map.Entry<String, Expression> member : getMembers().entrySet()) {
          data.put(member.getKey(), member.getValue().toData());
        }
        return data;
      }
      if (isList()) {
        final List<Object> data = new ArrayList<>();
        for (final Expression element : getElements()) {
          data.add(element.toData());
        }
        return data;
      }
      return value;
    }

    @Override
    public String toString() {
      return String.valueOf(toData());
    }
  }

  /**
   * A {@code @root.path.to.field} binding. The root is one of the well-known bindings (entity,
   * config, payload, state, now), a local introduced by let/fn, or a data entity name.
   */
  public static final class Reference extends Expression {
    private final String root;
    private final List<String> path;

    private Reference(final String root, final List<String> path) {
      this.root = root;
      this.path = Collections.unmodifiableList(path);
    }

    static boolean isBinding(final Object raw) {
      return raw instanceof String && ((String) raw).length() > 1
          && ((String) raw).charAt(0) == '@';
    }

    public static Reference parse(final String binding) {
      final String body = binding.startsWith("@") ? binding.substring(1) : binding;
      final String[] segments = body.split("\\.");
      final List<String> path = new ArrayList<>();
      for (int iter = 1; iter < segments.length; iter++) {
        path.add(segments[iter]);
      }
      return new Reference(segments[0], path);
    }

    public String getRoot() {
      return root;
    }

    public List<String> getPath() {
      return path;
    }

    public String getText() {
      final StringBuilder text = new StringBuilder("@").append(root);
      for (final String segment : path) {
        text.append('.').append(segment);
      }
      return text.toString();
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws BehaviorEngineException {
      return visitor.visitReference(this);
    }

    @Override
    public Object toData() {
      return getText();
    }

    @Override
    public String toString() {
      return getText();
    }
  }

  public static final class Call extends Expression {
    private final String operator;
    private final List<Expression> args;

    private Call(final String operator, final List<Expression> args) {
      this.operator = operator;
      this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String getOperator() {
      return operator;
    }

    public List<Expression> getArgs() {
      return args;
    }

    public int arity() {
      return args.size();
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) throws BehaviorEngineException {
      return visitor.visitCall(this);
    }

    @Override
    public Object toData() {
      final List<Object> data = new ArrayList<>();
      data.add(operator);
      for (final Expression arg : args) {
        data.add(arg.toData());
      }
      return data;
    }

    @Override
    public String toString() {
      return String.valueOf(toData());
    }
  }

}
