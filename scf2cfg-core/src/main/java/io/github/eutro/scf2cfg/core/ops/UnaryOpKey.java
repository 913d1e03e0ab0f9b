package io.github.eutro.scf2cfg.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * An op key with exactly one intermediate.
 *
 * @param <T> The type of the intermediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public class UnaryOp extends Op {
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    /**
     * Create an op of this key.
     *
     * @param arg The intermediate, not null.
     * @return The op.
     */
    public UnaryOp create(T arg) {
        if (arg == null) throw new IllegalArgumentException("intermediate of " + mnemonic + " is null");
        return new UnaryOp(arg);
    }

    // null if the key differs
    @SuppressWarnings("unchecked")
    public @Nullable UnaryOp checkNullable(Op val) {
        return val.key == this ? (UnaryOp) val : null;
    }

    public Optional<UnaryOp> check(Op val) {
        return Optional.ofNullable(checkNullable(val));
    }

    /**
     * Get {@code val} as an op of this key.
     *
     * @param val The op.
     * @return The op.
     * @throws ClassCastException If the op has a different key.
     */
    public UnaryOp cast(Op val) {
        UnaryOp op = checkNullable(val);
        if (op == null) throw new ClassCastException(val + " is not a " + mnemonic);
        return op;
    }
}
