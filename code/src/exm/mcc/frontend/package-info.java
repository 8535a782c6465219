/**
 * The frontend package contains the classes that take the token stream,
 * build the AST, and perform semantic analysis on it (declaration and
 * initialization checks over nested scopes).
 */
package exm.mcc.frontend;
