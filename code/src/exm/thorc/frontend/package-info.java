/**
 * The frontend package takes Thor source text to a merged, typed
 * program: parsing, import resolution and type inference.
 */
package exm.thorc.frontend;
