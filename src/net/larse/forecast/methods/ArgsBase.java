package net.larse.forecast.methods;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import org.apache.commons.lang3.reflect.FieldUtils;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;

/**
 * Base class of the parameter holders of all methods.
 *
 * A subclass declares one field per parameter and marks it {@link Required} or {@link Optional}.
 * Fields can be assigned directly or by name through {@link #setParameter(String, Object)}; the
 * latter is meant for callers that assemble a configuration step by step, e.g. from a map. A
 * method is only constructed from args that {@link #canBeExecuted()}.
 */
public abstract class ArgsBase {
  /** Human readable description of a parameter. */
  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.FIELD)
  public @interface Doc {
    String help();
  }

  /** The parameter has to be set before a method can be built. */
  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.FIELD)
  public @interface Required {}

  /** The parameter falls back to its field initializer. */
  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.FIELD)
  public @interface Optional {}

  private final Set<String> setParameters = new TreeSet<>();
  private Map<String, Field> fields;

  /**
   * Sets a parameter by name. Numbers are converted to the field's type; integer fields only
   * accept integral numbers, enum fields also accept the constant's name.
   *
   * @throws IllegalArgumentException for unknown names or values of the wrong type
   */
  public void setParameter(String name, Object value) {
    Field field = field(name);
    Object converted = convert(name, field.getType(), value);
    try {
      FieldUtils.writeField(field, this, converted, true);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Cannot write parameter " + name, e);
    }
    setParameters.add(name);
  }

  /** Sets all entries of the map, see {@link #setParameter(String, Object)}. */
  public void setParameters(Map<String, ?> parameters) {
    for (Map.Entry<String, ?> entry : parameters.entrySet()) {
      setParameter(entry.getKey(), entry.getValue());
    }
  }

  /**
   * @return the value of the parameter
   * @throws NoSuchElementException if the name is unknown, or names a required parameter that was
   *     never set
   */
  public Object getParameter(String name) {
    Field field = fields().get(name);
    if (field == null || (field.isAnnotationPresent(Required.class) && !isSet(name))) {
      throw new NoSuchElementException("Parameter " + name + " is not set");
    }
    try {
      return FieldUtils.readField(field, this, true);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Cannot read parameter " + name, e);
    }
  }

  /** True if the parameter was set by name, or marked as set by {@link #markSet(String)}. */
  public boolean isSet(String name) {
    return setParameters.contains(name);
  }

  /** The names of all parameters set so far. */
  public Set<String> getSetParameters() {
    return ImmutableSortedSet.copyOf(setParameters);
  }

  /** True once every required parameter has been set. */
  public boolean canBeExecuted() {
    return getMissingParameters().isEmpty();
  }

  public Set<String> getParameterNames() {
    return ImmutableSortedSet.copyOf(fields().keySet());
  }

  public Set<String> getRequiredParameters() {
    Set<String> required = new TreeSet<>();
    for (Map.Entry<String, Field> entry : fields().entrySet()) {
      if (entry.getValue().isAnnotationPresent(Required.class)) {
        required.add(entry.getKey());
      }
    }
    return required;
  }

  public Set<String> getMissingParameters() {
    Set<String> missing = getRequiredParameters();
    missing.removeAll(setParameters);
    return missing;
  }

  /** The {@link Doc} text of a parameter, or an empty string. */
  public String getDoc(String name) {
    Doc doc = field(name).getAnnotation(Doc.class);
    return doc == null ? "" : doc.help();
  }

  /**
   * Records a parameter as set after its field was assigned directly. Used by the positional
   * constructors of the methods.
   */
  protected void markSet(String name) {
    field(name);
    setParameters.add(name);
  }

  /**
   * Checks that a smoothing factor lies in the closed interval [0, 1].
   *
   * @throws IllegalArgumentException otherwise, NaN included
   */
  public static double checkUnitInterval(String name, double value) {
    Preconditions.checkArgument(value >= 0.0 && value <= 1.0,
        "%s has to be in [0, 1] but is %s", name, value);
    return value;
  }

  public static int checkPositive(String name, int value) {
    Preconditions.checkArgument(value > 0, "%s has to be positive but is %s", name, value);
    return value;
  }

  public static int checkNonNegative(String name, int value) {
    Preconditions.checkArgument(value >= 0, "%s has to be non-negative but is %s", name, value);
    return value;
  }

  private Field field(String name) {
    Field field = fields().get(name);
    Preconditions.checkArgument(field != null, "%s has no parameter %s",
        getClass().getName(), name);
    return field;
  }

  private Map<String, Field> fields() {
    if (fields == null) {
      Map<String, Field> found = new LinkedHashMap<>();
      List<Field> all = FieldUtils.getAllFieldsList(getClass());
      for (Field field : all) {
        if (field.isAnnotationPresent(Required.class) || field.isAnnotationPresent(Optional.class)) {
          found.put(field.getName(), field);
        }
      }
      fields = found;
    }
    return fields;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Object convert(String name, Class<?> type, Object value) {
    Preconditions.checkArgument(value != null || !type.isPrimitive(),
        "Parameter %s cannot be null", name);
    if (value == null) {
      return null;
    }
    if (type == double.class || type == Double.class) {
      Preconditions.checkArgument(value instanceof Number,
          "Parameter %s expects a number but got %s", name, value);
      return ((Number) value).doubleValue();
    }
    if (type == int.class || type == Integer.class) {
      Preconditions.checkArgument(value instanceof Number,
          "Parameter %s expects an integer but got %s", name, value);
      double d = ((Number) value).doubleValue();
      Preconditions.checkArgument(d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE,
          "Parameter %s expects an integer but got %s", name, value);
      return (int) d;
    }
    if (type.isEnum()) {
      if (value instanceof String) {
        return Enum.valueOf((Class<Enum>) type, ((String) value).toUpperCase(Locale.ROOT));
      }
    }
    if (type == double[].class && value instanceof List) {
      List<?> list = (List<?>) value;
      double[] array = new double[list.size()];
      for (int i = 0; i < array.length; i++) {
        array[i] = (Double) convert(name, double.class, list.get(i));
      }
      return array;
    }
    Preconditions.checkArgument(type.isInstance(value),
        "Parameter %s expects a %s but got %s", name, type.getSimpleName(), value);
    return type == double[].class ? ((double[]) value).clone() : value;
  }
}
