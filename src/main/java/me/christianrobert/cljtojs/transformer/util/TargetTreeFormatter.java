package me.christianrobert.cljtojs.transformer.util;

import me.christianrobert.cljtojs.target.ArithmeticOperation;
import me.christianrobert.cljtojs.target.ArrayLiteral;
import me.christianrobert.cljtojs.target.Assignment;
import me.christianrobert.cljtojs.target.BooleanLiteral;
import me.christianrobert.cljtojs.target.Comparison;
import me.christianrobert.cljtojs.target.Conditional;
import me.christianrobert.cljtojs.target.FunctionDeclaration;
import me.christianrobert.cljtojs.target.IndexedSymbolReference;
import me.christianrobert.cljtojs.target.InfiniteLoop;
import me.christianrobert.cljtojs.target.Invocation;
import me.christianrobert.cljtojs.target.LambdaExpression;
import me.christianrobert.cljtojs.target.LoopContinue;
import me.christianrobert.cljtojs.target.NamespaceDeclaration;
import me.christianrobert.cljtojs.target.NumberLiteral;
import me.christianrobert.cljtojs.target.ObjectConstruction;
import me.christianrobert.cljtojs.target.PropertyAccess;
import me.christianrobert.cljtojs.target.ScopeBlock;
import me.christianrobert.cljtojs.target.StringLiteral;
import me.christianrobert.cljtojs.target.SymbolReference;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.target.TargetNodeVisitor;
import me.christianrobert.cljtojs.target.VariableDeclaration;

import java.util.List;

/**
 * Formats target node sequences into human-readable, indented text.
 *
 * <p>Example output for {@code (and a b)}:</p>
 * <pre>
 * var and$1
 *   symbol a
 * if
 *   test:
 *     symbol and$1
 *   then:
 *     var and$2
 *       symbol b
 *     symbol and$2
 *   else:
 *     symbol and$1
 * </pre>
 */
public class TargetTreeFormatter implements TargetNodeVisitor<Void> {

  private static final String INDENT = "  ";

  private final StringBuilder sb = new StringBuilder();
  private int depth;

  private TargetTreeFormatter() {
  }

  /**
   * Formats a translated sequence into human-readable text.
   *
   * @param nodes Target nodes in execution order
   * @return Formatted string representation
   */
  public static String format(List<TargetNode> nodes) {
    if (nodes == null) {
      return "(null tree)";
    }
    if (nodes.isEmpty()) {
      return "(empty)\n";
    }
    TargetTreeFormatter formatter = new TargetTreeFormatter();
    formatter.children(nodes);
    return formatter.sb.toString();
  }

  private void line(String text) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    sb.append(text).append("\n");
  }

  private void children(List<TargetNode> nodes) {
    for (TargetNode node : nodes) {
      node.accept(this);
    }
  }

  private Void block(String header, List<TargetNode> nodes) {
    line(header);
    depth++;
    children(nodes);
    depth--;
    return null;
  }

  private void labelled(String label, List<TargetNode> nodes) {
    line(label + ":");
    depth++;
    children(nodes);
    depth--;
  }

  @Override
  public Void visitNamespace(NamespaceDeclaration node) {
    return block("namespace", node.getName());
  }

  @Override
  public Void visitVariable(VariableDeclaration node) {
    return block("var " + node.getName().getName(), node.getInitializer());
  }

  @Override
  public Void visitFunction(FunctionDeclaration node) {
    line("function " + node.getName().getName());
    depth++;
    labelled("params", node.getParameters());
    labelled("body", node.getBody());
    depth--;
    return null;
  }

  @Override
  public Void visitLambda(LambdaExpression node) {
    line("lambda");
    depth++;
    labelled("params", node.getParameters());
    labelled("body", node.getBody());
    depth--;
    return null;
  }

  @Override
  public Void visitAssignment(Assignment node) {
    line("assign");
    depth++;
    labelled("target", node.getTarget());
    labelled("value", node.getValue());
    depth--;
    return null;
  }

  @Override
  public Void visitConditional(Conditional node) {
    line("if");
    depth++;
    labelled("test", node.getTest());
    labelled("then", node.getConsequent());
    if (node.hasAlternative()) {
      labelled("else", node.getAlternative());
    }
    depth--;
    return null;
  }

  @Override
  public Void visitComparison(Comparison node) {
    return binary("compare " + node.getOperator(), node.getLeft(), node.getRight());
  }

  @Override
  public Void visitArithmetic(ArithmeticOperation node) {
    return binary("arithmetic " + node.getOperator(), node.getLeft(), node.getRight());
  }

  private Void binary(String header, List<TargetNode> left, List<TargetNode> right) {
    line(header);
    depth++;
    labelled("left", left);
    labelled("right", right);
    depth--;
    return null;
  }

  @Override
  public Void visitInvocation(Invocation node) {
    line("call");
    depth++;
    labelled("callee", node.getCallee());
    labelled("args", node.getArguments());
    depth--;
    return null;
  }

  @Override
  public Void visitPropertyAccess(PropertyAccess node) {
    return block("property " + node.getProperty().getName(), node.getObject());
  }

  @Override
  public Void visitObjectConstruction(ObjectConstruction node) {
    line("new");
    depth++;
    labelled("constructor", node.getConstructor());
    labelled("args", node.getArguments());
    depth--;
    return null;
  }

  @Override
  public Void visitArrayLiteral(ArrayLiteral node) {
    return block("array", node.getElements());
  }

  @Override
  public Void visitSymbol(SymbolReference node) {
    line("symbol " + node.getName());
    return null;
  }

  @Override
  public Void visitIndexedSymbol(IndexedSymbolReference node) {
    line("slot " + node.getIndex());
    return null;
  }

  @Override
  public Void visitString(StringLiteral node) {
    line("string \"" + SourceTreeFormatter.escapeAndTruncate(node.getValue()) + "\"");
    return null;
  }

  @Override
  public Void visitNumber(NumberLiteral node) {
    line("number " + node.getText());
    return null;
  }

  @Override
  public Void visitBoolean(BooleanLiteral node) {
    line("boolean " + node.getValue());
    return null;
  }

  @Override
  public Void visitScope(ScopeBlock node) {
    return block("scope", node.getBody());
  }

  @Override
  public Void visitInfiniteLoop(InfiniteLoop node) {
    return block("loop", node.getBody());
  }

  @Override
  public Void visitContinue(LoopContinue node) {
    line("continue");
    return null;
  }
}
