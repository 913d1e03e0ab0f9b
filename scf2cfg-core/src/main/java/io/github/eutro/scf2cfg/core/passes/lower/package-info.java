/**
 * Rewrites that lower structured control flow into a flat graph of blocks.
 *
 * @see io.github.eutro.scf2cfg.core.passes.lower.LowerStructuredControl
 */
package io.github.eutro.scf2cfg.core.passes.lower;
