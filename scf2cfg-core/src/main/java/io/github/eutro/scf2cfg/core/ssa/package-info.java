/**
 * This package defines the region-based intermediate representation (IR) that structured
 * control flow is lowered in.
 * <p>
 * A {@link io.github.eutro.scf2cfg.core.ssa.Function} has a body
 * {@link io.github.eutro.scf2cfg.core.ssa.Region}, a list of
 * {@link io.github.eutro.scf2cfg.core.ssa.BasicBlock}s. Instructions that represent structured
 * control flow, like {@link io.github.eutro.scf2cfg.core.ops.StructuredOps#FOR loops}, own further
 * regions of their own. Once those are {@link io.github.eutro.scf2cfg.core.passes.lower lowered},
 * the body is the only region left, and the function is a flat control-flow graph.
 * <p>
 * The IR is always in static single assignment form (SSA). Each
 * {@link io.github.eutro.scf2cfg.core.ssa.Var} is either the result of exactly one
 * {@link io.github.eutro.scf2cfg.core.ssa.Effect}, or an argument of exactly one block,
 * and its definition dominates all of its uses. Values coming from several predecessors are
 * merged through block arguments; there are no phi instructions.
 * <p>
 * A region nested in an instruction may use any value that is visible at that instruction.
 * Branches never cross region boundaries; control leaves a nested region only through its
 * terminator, like a {@link io.github.eutro.scf2cfg.core.ops.StructuredOps#YIELD yield}.
 */
package io.github.eutro.scf2cfg.core.ssa;
