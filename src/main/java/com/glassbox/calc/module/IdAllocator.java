package com.glassbox.calc.module;

import java.util.BitSet;

import com.glassbox.calc.util.SpecificationException;

/**
 * Hands out integer ids. Explicit ids are claimed first; allocation then skips
 * them, and blocks are always contiguous.
 *
 * <p>
 * One allocator per id space (calculations, modules, calculation groups) is
 * threaded through a compilation. Not thread-safe.
 */
public final class IdAllocator {
    private final BitSet taken = new BitSet();
    private int next;

    private IdAllocator(int first) {
        if (first < 0)
            throw new IllegalArgumentException("first id must be non-negative: " + first);
        this.next = first;
    }

    public static IdAllocator startingAt(int first) {
        return new IdAllocator(first);
    }

    /**
     * Reserves an explicit id.
     *
     * @throws SpecificationException if it is already taken
     */
    public void claim(int id) {
        if (id < 0)
            throw new IllegalArgumentException("id must be non-negative: " + id);
        if (taken.get(id))
            throw new SpecificationException("Duplicate id: " + id);
        taken.set(id);
    }

    public boolean isTaken(int id) {
        return id >= 0 && taken.get(id);
    }

    public int next() {
        return allocateBlock(1);
    }

    /** First id of a fresh run of {@code size} consecutive ids. */
    public int allocateBlock(int size) {
        if (size < 0)
            throw new IllegalArgumentException("size must be non-negative: " + size);
        int start = next;
        while (true) {
            int clash = taken.nextSetBit(start);
            if (clash < 0 || clash >= start + size)
                break;
            start = clash + 1;
        }
        taken.set(start, start + size);
        next = start + size;
        return start;
    }

    /** The id the next single allocation would start from, ignoring claims. */
    public int peek() {
        return next;
    }

    /** Moves the cursor forward; never backwards. */
    public void advanceTo(int id) {
        if (id > next)
            next = id;
    }
}
