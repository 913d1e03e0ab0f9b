/**
 * Passes that turn the IR into something else.
 */
package io.github.eutro.scf2cfg.core.passes.convert;
