package io.github.eutro.scf2cfg.core.ops;

import io.github.eutro.scf2cfg.core.ext.ExtHolder;

/**
 * An operation key, a type of operation without its intermediates.
 * <p>
 * Exts attached here, like {@link io.github.eutro.scf2cfg.core.ext.CommonExts#OP_KIND},
 * are seen by every op and instruction of the key.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
