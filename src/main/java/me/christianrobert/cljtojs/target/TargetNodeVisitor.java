package me.christianrobert.cljtojs.target;

/**
 * Visitor over all target node variants.
 *
 * @param <T> Result type of the visit
 */
public interface TargetNodeVisitor<T> {

    T visitNamespace(NamespaceDeclaration node);

    T visitVariable(VariableDeclaration node);

    T visitFunction(FunctionDeclaration node);

    T visitLambda(LambdaExpression node);

    T visitAssignment(Assignment node);

    T visitConditional(Conditional node);

    T visitComparison(Comparison node);

    T visitArithmetic(ArithmeticOperation node);

    T visitInvocation(Invocation node);

    T visitPropertyAccess(PropertyAccess node);

    T visitObjectConstruction(ObjectConstruction node);

    T visitArrayLiteral(ArrayLiteral node);

    T visitSymbol(SymbolReference node);

    T visitIndexedSymbol(IndexedSymbolReference node);

    T visitString(StringLiteral node);

    T visitNumber(NumberLiteral node);

    T visitBoolean(BooleanLiteral node);

    T visitScope(ScopeBlock node);

    T visitInfiniteLoop(InfiniteLoop node);

    T visitContinue(LoopContinue node);
}
