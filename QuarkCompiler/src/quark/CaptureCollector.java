package quark;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Computes the free variables a lambda must copy into its environment.
 *
 * <p>A name is captured when it is not a parameter of the lambda (or of a lambda nested inside it
 * on the path to the reference), is not a builtin, is not declared inside the lambda, and names a
 * variable visible from the lambda's enclosing scope. Because nested lambda bodies are scanned too,
 * a variable used only by an inner lambda is also captured by every lambda around it.
 */
final class CaptureCollector {
  private final Builtins builtins;
  private final ImmutableSet<String> locals;
  private final Predicate<String> isEnclosingVariable;
  private final Set<String> captured = new LinkedHashSet<>();

  private CaptureCollector(
      Builtins builtins, Set<String> locals, Predicate<String> isEnclosingVariable) {
    this.builtins = builtins;
    this.locals = ImmutableSet.copyOf(locals);
    this.isEnclosingVariable = isEnclosingVariable;
  }

  /**
   * @param locals names declared anywhere inside the lambda body, excluding nested lambdas
   * @param isEnclosingVariable whether a name resolves to a variable from the enclosing scope
   */
  static ImmutableList<String> collect(
      Node lambda,
      Builtins builtins,
      Set<String> locals,
      Predicate<String> isEnclosingVariable) {
    Preconditions.checkArgument(lambda.is(NodeKind.LAMBDA), "not a lambda: %s", lambda);
    CaptureCollector collector = new CaptureCollector(builtins, locals, isEnclosingVariable);
    collector.visitLambda(lambda, new HashSet<>());
    return ImmutableList.copyOf(collector.captured);
  }

  private void visitLambda(Node lambda, Set<String> outerParams) {
    Set<String> params = new HashSet<>(outerParams);
    lambda.child(0).children().forEach(p -> params.add(p.literal()));
    visit(lambda.child(1), params);
  }

  private void visit(Node node, Set<String> params) {
    switch (node.kind()) {
      case LAMBDA:
        visitLambda(node, params);
        return;
      case FUNCTION:
        // Named functions are hoisted and cannot see the lambda's variables.
        return;
      case IDENTIFIER:
        {
          String name = node.literal();
          if (!params.contains(name)
              && !builtins.contains(name)
              && !locals.contains(name)
              && isEnclosingVariable.test(name)) {
            captured.add(name);
          }
          return;
        }
      default:
        node.children().forEach(c -> visit(c, params));
    }
  }
}
