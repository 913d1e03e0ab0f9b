package io.github.eutro.scf2cfg.core.ops;

/**
 * An op key without intermediates, so it has exactly one op.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    public Op create() {
        return op;
    }
}
