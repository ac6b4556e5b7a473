/**
 * Syntax tree for Thor programs, with the visitor interfaces used by
 * every later pass.
 */
package exm.thorc.ast;
