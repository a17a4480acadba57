package io.flowcraft.core.expression;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// A parsed, reusable boolean condition.
///
/// Parsing happens once, when the workflow is compiled; {@link #test} only
/// walks the tree.
///
/// {@snippet :
/// Predicate approved = Predicate.compile("score >= 7 and status == 'done'");
/// boolean next = approved.test(variables);
/// }
public final class Predicate {

    private final String source;
    private final Expression expression;

    private Predicate(String source, Expression expression) {
        this.source = source;
        this.expression = expression;
    }

    /// Parses a predicate.
    ///
    /// @param source predicate text, not null
    /// @return compiled predicate, never null
    /// @throws ExpressionException if the text is not a valid predicate
    public static Predicate compile(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new Predicate(source, ExpressionParser.parse(source));
    }

    /// Evaluates the predicate.
    ///
    /// @param variables path values, not null
    /// @return whether the condition holds
    /// @throws ExpressionException on evaluation type errors
    public boolean test(VariableSource variables) {
        return ExpressionEvaluator.test(source, expression, variables);
    }

    /// Returns every path referenced by the predicate, in source order.
    public Set<String> referencedPaths() {
        Set<String> paths = new LinkedHashSet<>();
        collect(expression, paths);
        return paths;
    }

    private static void collect(Expression expression, Set<String> out) {
        if (expression instanceof Expression.PathRef ref) {
            out.add(ref.path());
        } else if (expression instanceof Expression.Unary unary) {
            collect(unary.operand(), out);
        } else if (expression instanceof Expression.Binary binary) {
            collect(binary.left(), out);
            collect(binary.right(), out);
        }
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
