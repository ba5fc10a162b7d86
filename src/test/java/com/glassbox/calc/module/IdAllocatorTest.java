package com.glassbox.calc.module;

import org.junit.Test;

import com.glassbox.calc.util.SpecificationException;

import static org.junit.Assert.*;

public class IdAllocatorTest {

    @Test
    public void testSequentialAllocation() {
        IdAllocator ids = IdAllocator.startingAt(1);
        assertEquals(1, ids.next());
        assertEquals(2, ids.next());
        assertEquals(3, ids.peek());
    }

    @Test
    public void testAllocationSkipsClaimedIds() {
        IdAllocator ids = IdAllocator.startingAt(1);
        ids.claim(2);
        assertEquals(1, ids.next());
        assertEquals(3, ids.next());
        assertTrue(ids.isTaken(2));
        assertFalse(ids.isTaken(4));
    }

    @Test
    public void testBlocksAreContiguous() {
        IdAllocator ids = IdAllocator.startingAt(10);
        ids.claim(12);
        // 10..12 would overlap the claim, so the block starts after it
        assertEquals(13, ids.allocateBlock(3));
        assertEquals(16, ids.next());
        // Small gaps before the cursor are not reused
        assertEquals(17, ids.allocateBlock(2));
    }

    @Test
    public void testEmptyBlockDoesNotAdvance() {
        IdAllocator ids = IdAllocator.startingAt(5);
        assertEquals(5, ids.allocateBlock(0));
        assertEquals(5, ids.next());
    }

    @Test
    public void testAdvanceOnlyMovesForward() {
        IdAllocator ids = IdAllocator.startingAt(1);
        ids.advanceTo(20);
        assertEquals(20, ids.peek());
        ids.advanceTo(3);
        assertEquals(20, ids.next());
    }

    @Test
    public void testDuplicateClaimRejected() {
        IdAllocator ids = IdAllocator.startingAt(1);
        ids.claim(4);
        try {
            ids.claim(4);
            fail("Expected SpecificationException");
        } catch (SpecificationException e) {
            assertEquals("Duplicate id: 4", e.getMessage());
        }
    }

    @Test(expected = SpecificationException.class)
    public void testClaimOfAllocatedIdRejected() {
        IdAllocator ids = IdAllocator.startingAt(1);
        ids.next();
        ids.claim(1);
    }
}
