package org.boblycat.exectrace.core.trace;

import org.boblycat.exectrace.core.AddressRange;
import org.boblycat.exectrace.core.BinaryCodeChunk;
import org.boblycat.exectrace.core.CodeBlock;
import org.boblycat.exectrace.core.Successor;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.TreeMap;

public class TestTraceResult {

    private static TraceResult result(CodeBlock... blocks) {
        return new TraceResult(new BinaryCodeChunk(new byte[32]), Arrays.asList(blocks),
                               new TreeMap<Long, String>(), new TreeMap<Long, Integer>());
    }

    @Test
    public void testBlocksAreCopied() {
        final CodeBlock block = new CodeBlock(0, 9, Successor.to(12));
        block.addSubroutineCall(3, 12);
        final TraceResult result = result(block);

        final CodeBlock head = block.splitAt(5);
        block.addSubroutineCall(7, 20);
        Assert.assertEquals(0, head.getStart());

        final CodeBlock copy = result.blockAt(5);
        Assert.assertNotSame(block, copy);
        Assert.assertEquals(0, copy.getStart());
        Assert.assertEquals(9, copy.getEnd());
        Assert.assertEquals(Collections.singletonList(Successor.to(12)), copy.getSuccessors());
        Assert.assertEquals(Collections.singletonMap(3L, 12L), copy.getCalls());
    }

    @Test
    public void testGroupedRangesMergesEveryAdjacentRun() {
        final TraceResult result = result(new CodeBlock(10, 12),
                                          new CodeBlock(0, 1, Successor.to(2)),
                                          new CodeBlock(6, 7, Successor.to(10)),
                                          new CodeBlock(2, 4, Successor.to(6)),
                                          new CodeBlock(9, 9, Successor.to(10)));

        Assert.assertEquals(Arrays.asList(new AddressRange(0, 4),
                                          new AddressRange(6, 7),
                                          new AddressRange(9, 12)),
                            result.groupedRanges());
    }

    @Test
    public void testGroupedRangesJoinsTouchingEnds() {
        final TraceResult result = result(new CodeBlock(0, 3), new CodeBlock(3, 5), new CodeBlock(8, 8));

        Assert.assertEquals(Arrays.asList(new AddressRange(0, 5), new AddressRange(8, 8)),
                            result.groupedRanges());
    }

    @Test
    public void testGroupedRangesOfEmptyTrace() {
        Assert.assertTrue(result().groupedRanges().isEmpty());
        Assert.assertEquals(0, result().codeSize());
    }

    @Test
    public void testBlockLookup() {
        final CodeBlock first = new CodeBlock(0, 3, Successor.to(8));
        final CodeBlock second = new CodeBlock(8, 9, Successor.to(20), Successor.terminal("bad"));
        final TraceResult result = result(second, first);

        Assert.assertEquals(Arrays.asList(first, second), result.getBlocks());
        Assert.assertSame(first, result.blockAt(2));
        Assert.assertNull(result.blockAt(5));
        Assert.assertSame(second, result.blockStartingAt(8));
        Assert.assertNull(result.blockStartingAt(9));
        Assert.assertEquals(6, result.codeSize());
        Assert.assertEquals(Collections.singleton(20L), result.danglingSuccessors());
    }
}
