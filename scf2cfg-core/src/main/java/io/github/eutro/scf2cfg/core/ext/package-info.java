/**
 * Metadata attached to IR objects without changing their classes.
 *
 * <pre>{@code
 * Var iv = func.newVar("iv", Type.INT_TYPE);
 * iv.getExtOrThrow(CommonExts.TYPE); // => I
 *
 * ComputeUses.INSTANCE.run(func);
 * iv.getExtOrThrow(CommonExts.USED_AT); // => every Insn reading iv
 * }</pre>
 * <p>
 * Analyses such as {@link io.github.eutro.scf2cfg.core.passes.meta.ComputeDoms} store their
 * results as exts on the blocks and vars they describe, and record their validity in the
 * function's {@link io.github.eutro.scf2cfg.core.ext.MetadataState}, so passes that mutate
 * the graph only have to invalidate it.
 * <p>
 * IR classes keep the exts they are asked for most often, like ownership and
 * {@link io.github.eutro.scf2cfg.core.ext.CommonExts#ASSIGNED_AT}, in plain fields.
 */
package io.github.eutro.scf2cfg.core.ext;
