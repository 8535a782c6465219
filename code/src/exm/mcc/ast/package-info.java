/**
 * Abstract syntax tree produced by the parser.  Expressions and
 * statements are closed families: subclasses can only be declared in
 * this package, and consumers match on them with ExprVisitor and
 * StmtVisitor.  Every node is owned by exactly one parent.
 */
package exm.mcc.ast;
