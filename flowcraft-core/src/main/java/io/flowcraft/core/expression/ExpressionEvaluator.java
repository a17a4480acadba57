package io.flowcraft.core.expression;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/// Tree-walking interpreter for parsed predicates.
///
/// ### Semantics
/// - A path that does not resolve evaluates to an internal missing marker;
///   any comparison involving it is false and arithmetic propagates it
/// - `and`/`or` short-circuit and return booleans
/// - Numbers compare numerically regardless of integral or floating form
/// - Strings order lexicographically; `+` concatenates two strings
/// - Truthiness: null, false, zero, empty strings and empty collections are false
///
/// @implNote Stateless and thread-safe.
public final class ExpressionEvaluator {

    private static final Object MISSING = new Object();

    private ExpressionEvaluator() {}

    /// Evaluates an expression to a boolean using truthiness rules.
    ///
    /// @param source original text, used in error messages, not null
    /// @param expression parsed AST, not null
    /// @param variables path values, not null
    /// @return truthiness of the result
    /// @throws ExpressionException on type errors such as dividing by zero
    public static boolean test(String source, Expression expression, VariableSource variables) {
        return truthy(new Evaluation(source, variables).eval(expression));
    }

    /// Evaluates an expression to its raw value.
    ///
    /// @return result value; null when it resolves to a missing path
    public static Object evaluate(String source, Expression expression, VariableSource variables) {
        Object value = new Evaluation(source, variables).eval(expression);
        return value == MISSING ? null : value;
    }

    static boolean truthy(Object value) {
        if (value == null || value == MISSING) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    private record Evaluation(String source, VariableSource variables) {

        Object eval(Expression expression) {
            if (expression instanceof Expression.Literal literal) {
                return literal.value();
            }
            if (expression instanceof Expression.PathRef ref) {
                return variables.has(ref.path()) ? variables.get(ref.path()) : MISSING;
            }
            if (expression instanceof Expression.Unary unary) {
                return unary(unary);
            }
            return binary((Expression.Binary) expression);
        }

        private Object unary(Expression.Unary unary) {
            Object operand = eval(unary.operand());
            if (unary.operator() == Expression.Operator.NOT) {
                return !truthy(operand);
            }
            if (operand == MISSING) {
                return MISSING;
            }
            if (operand instanceof Long l) {
                return -l;
            }
            if (operand instanceof Number n) {
                return -n.doubleValue();
            }
            throw error("Cannot negate " + describe(operand));
        }

        private Object binary(Expression.Binary binary) {
            Expression.Operator operator = binary.operator();
            if (operator == Expression.Operator.AND) {
                return truthy(eval(binary.left())) && truthy(eval(binary.right()));
            }
            if (operator == Expression.Operator.OR) {
                return truthy(eval(binary.left())) || truthy(eval(binary.right()));
            }

            Object left = eval(binary.left());
            Object right = eval(binary.right());

            if (operator.isComparison()) {
                if (left == MISSING || right == MISSING) {
                    return false;
                }
                return compare(operator, left, right);
            }
            if (left == MISSING || right == MISSING) {
                return MISSING;
            }
            return arithmetic(operator, left, right);
        }

        private boolean compare(Expression.Operator operator, Object left, Object right) {
            if (operator == Expression.Operator.EQ) {
                return equal(left, right);
            }
            if (operator == Expression.Operator.NE) {
                return !equal(left, right);
            }
            int order;
            if (left instanceof Number a && right instanceof Number b) {
                order = Double.compare(a.doubleValue(), b.doubleValue());
            } else if (left instanceof String a && right instanceof String b) {
                order = a.compareTo(b);
            } else {
                throw error(
                        "Cannot order "
                                + describe(left)
                                + " "
                                + operator.symbol()
                                + " "
                                + describe(right));
            }
            return switch (operator) {
                case LT -> order < 0;
                case LE -> order <= 0;
                case GT -> order > 0;
                case GE -> order >= 0;
                default -> throw new IllegalStateException("Not an ordering: " + operator);
            };
        }

        private static boolean equal(Object left, Object right) {
            if (left instanceof Number a && right instanceof Number b) {
                return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
            }
            return Objects.equals(left, right);
        }

        private Object arithmetic(Expression.Operator operator, Object left, Object right) {
            if (operator == Expression.Operator.ADD
                    && left instanceof String a
                    && right instanceof String b) {
                return a + b;
            }
            if (!(left instanceof Number a) || !(right instanceof Number b)) {
                throw error(
                        "Cannot apply '"
                                + operator.symbol()
                                + "' to "
                                + describe(left)
                                + " and "
                                + describe(right));
            }
            boolean integral = a instanceof Long && b instanceof Long;
            if ((operator == Expression.Operator.DIVIDE || operator == Expression.Operator.MODULO)
                    && b.doubleValue() == 0.0) {
                throw error("Division by zero");
            }
            if (integral) {
                long x = a.longValue();
                long y = b.longValue();
                return switch (operator) {
                    case ADD -> x + y;
                    case SUBTRACT -> x - y;
                    case MULTIPLY -> x * y;
                    case DIVIDE -> (double) x / y;
                    case MODULO -> x % y;
                    default -> throw new IllegalStateException("Not arithmetic: " + operator);
                };
            }
            double x = a.doubleValue();
            double y = b.doubleValue();
            return switch (operator) {
                case ADD -> x + y;
                case SUBTRACT -> x - y;
                case MULTIPLY -> x * y;
                case DIVIDE -> x / y;
                case MODULO -> x % y;
                default -> throw new IllegalStateException("Not arithmetic: " + operator);
            };
        }

        private static String describe(Object value) {
            if (value == null) {
                return "null";
            }
            return value.getClass().getSimpleName() + "(" + value + ")";
        }

        private ExpressionException error(String message) {
            return new ExpressionException(source, message);
        }
    }
}
