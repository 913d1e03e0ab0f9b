package io.github.eutro.scf2cfg.core.ops;

import org.objectweb.asm.commons.GeneratorAdapter;

/**
 * Integer arithmetic. All operations work on two operands of the same type,
 * {@code int} or {@code long}, are signed and wrap on overflow.
 */
public class ArithOps {
    public static final Op ADD = new SimpleOpKey("add").create();
    public static final Op SUB = new SimpleOpKey("sub").create();
    public static final Op MUL = new SimpleOpKey("mul").create();
    /**
     * Effect: compares its two arguments with the given predicate, returning a {@code boolean}.
     */
    public static final UnaryOpKey<Predicate> CMP = new UnaryOpKey<>("cmp", Predicate::toString);

    /**
     * A signed comparison.
     */
    public enum Predicate {
        EQ("eq", GeneratorAdapter.EQ),
        NE("ne", GeneratorAdapter.NE),
        SLT("slt", GeneratorAdapter.LT),
        SLE("sle", GeneratorAdapter.LE),
        SGT("sgt", GeneratorAdapter.GT),
        SGE("sge", GeneratorAdapter.GE),
        ;

        private final String mnemonic;
        /**
         * The comparison mode, as taken by {@link GeneratorAdapter#ifCmp}.
         */
        public final int mode;

        Predicate(String mnemonic, int mode) {
            this.mnemonic = mnemonic;
            this.mode = mode;
        }

        public boolean test(long l, long r) {
            switch (this) {
                // @formatter:off
                case EQ: return l == r;
                case NE: return l != r;
                case SLT: return l < r;
                case SLE: return l <= r;
                case SGT: return l > r;
                case SGE: return l >= r;
                // @formatter:on
                default:
                    throw new IllegalStateException();
            }
        }

        @Override
        public String toString() {
            return mnemonic;
        }
    }
}
