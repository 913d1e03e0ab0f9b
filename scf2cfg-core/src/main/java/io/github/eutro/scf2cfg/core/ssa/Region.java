package io.github.eutro.scf2cfg.core.ssa;

import io.github.eutro.scf2cfg.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A region, an ordered list of {@link BasicBlock basic blocks}, owned either by
 * a {@link Function} as its body or by an {@link Insn} as a nested region.
 * <p>
 * The first block is the entry. Branches never leave a region.
 */
public final class Region extends ExtHolder {
    /**
     * The blocks of this region. The first one is the entry.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_REGION, Region.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            if (elt.getNullable(CommonExts.OWNING_REGION) == Region.this) {
                elt.removeExt(CommonExts.OWNING_REGION);
            }
        }
    };

    /**
     * Create a new block at the end of this region.
     *
     * @return The new block.
     */
    public BasicBlock newBb() {
        return newBbAt(blocks.size());
    }

    /**
     * Create a new block at the given position in this region.
     *
     * @param index The index the block will have.
     * @return The new block.
     */
    public BasicBlock newBbAt(int index) {
        BasicBlock bb = new BasicBlock();
        blocks.add(index, bb);
        return bb;
    }

    /**
     * Get the entry block of this region.
     *
     * @return The entry block.
     * @throws IllegalStateException If the region is empty.
     */
    public BasicBlock getEntry() {
        if (blocks.isEmpty()) throw new IllegalStateException("region is empty");
        return blocks.get(0);
    }

    /**
     * Get the last block of this region, which holds the region's terminator in single-exit regions.
     *
     * @return The last block.
     * @throws IllegalStateException If the region is empty.
     */
    public BasicBlock getLast() {
        if (blocks.isEmpty()) throw new IllegalStateException("region is empty");
        return blocks.get(blocks.size() - 1);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (BasicBlock block : blocks) {
            sb.append("\n  ").append(block.toString().replace("\n", "\n  "));
        }
        sb.append("\n}");
        return sb.toString();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_INSN) {
            return owner instanceof Insn ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_FUNCTION) {
            return owner instanceof Function ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_INSN || ext == CommonExts.OWNING_FUNCTION) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_INSN || ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
