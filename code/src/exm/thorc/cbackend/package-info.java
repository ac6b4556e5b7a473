/**
 * Generates a C translation unit from the merged program.  The tree
 * subpackage models the C constructs that are emitted.
 */
package exm.thorc.cbackend;
