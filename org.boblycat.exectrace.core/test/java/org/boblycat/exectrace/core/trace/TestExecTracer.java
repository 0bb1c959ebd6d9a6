package org.boblycat.exectrace.core.trace;

import org.boblycat.exectrace.core.AddressOutOfRangeException;
import org.boblycat.exectrace.core.BinaryCodeChunk;
import org.boblycat.exectrace.core.CodeBlock;
import org.boblycat.exectrace.core.ExecTraceException;
import org.boblycat.exectrace.core.IllegalInstructionException;
import org.boblycat.exectrace.core.Successor;
import org.boblycat.exectrace.core.ToyDisasm;
import org.boblycat.exectrace.core.disassembler.DecodedInstr;
import org.boblycat.exectrace.core.disassembler.Disassembler;
import org.boblycat.exectrace.core.disassembler.Flow;
import org.boblycat.exectrace.core.disassembler.InstructionCursor;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.boblycat.exectrace.core.ToyDisasm.*;

public class TestExecTracer {

    private static ExecTracer tracer(byte[] image) {
        return new ExecTracer(new BinaryCodeChunk(image), new ToyDisasm());
    }

    private static void assertBlock(CodeBlock block, long start, long end, Successor... successors) {
        Assert.assertNotNull("no block at " + start, block);
        Assert.assertEquals("start", start, block.getStart());
        Assert.assertEquals("end", end, block.getEnd());
        Assert.assertEquals("successors", Arrays.asList(successors), block.getSuccessors());
    }

    private static Successor to(long address) {
        return Successor.to(address);
    }

    @Test
    public void testNopReturn() throws Exception {
        final TraceResult result = tracer(image(4, 0, NOP, RET)).run(0);

        Assert.assertEquals(1, result.getBlocks().size());
        assertBlock(result.getBlocks().get(0), 0, 1);
        Assert.assertEquals("NOP", result.getDisassembly().get(0L));
        Assert.assertEquals("RET", result.getDisassembly().get(1L));
    }

    @Test
    public void testJumpSkipsData() throws Exception {
        final TraceResult result = tracer(image(6, 0, JMP, 4, 0xAA, 0xBB, NOP, RET)).run(0);

        Assert.assertEquals(2, result.getBlocks().size());
        assertBlock(result.blockStartingAt(0), 0, 1, to(4));
        assertBlock(result.blockStartingAt(4), 4, 5);
        Assert.assertNull(result.blockAt(2));
        Assert.assertNull(result.blockAt(3));
    }

    @Test
    public void testCallRecordsSubroutine() throws Exception {
        final byte[] image = image(12, 0, CALL, 10, RET);
        put(image, 10, NOP, RET);
        final TraceResult result = tracer(image).run(0);

        Assert.assertEquals(3, result.getBlocks().size());
        final CodeBlock caller = result.blockStartingAt(0);
        assertBlock(caller, 0, 1, to(2), to(10));
        Assert.assertEquals(Collections.singletonMap(0L, 10L), caller.getCalls());
        assertBlock(result.blockStartingAt(2), 2, 2);
        assertBlock(result.blockStartingAt(10), 10, 11);
    }

    @Test
    public void testConditionalBackwardBranchSplitsScan() throws Exception {
        // 0..6 NOP, 7: JZ 5, 9: RET
        final byte[] image = image(10, 7, JZ, 5, RET);
        final TraceResult result = tracer(image).run(0);

        Assert.assertEquals(3, result.getBlocks().size());
        assertBlock(result.blockStartingAt(0), 0, 4, to(5));
        assertBlock(result.blockStartingAt(5), 5, 8, to(9), to(5));
        assertBlock(result.blockStartingAt(9), 9, 9);
    }

    @Test
    public void testUnconditionalBackwardJumpLeavesFallThroughUnscanned() throws Exception {
        final byte[] image = image(10, 7, JMP, 5, RET);
        final TraceResult result = tracer(image).run(0);

        Assert.assertEquals(2, result.getBlocks().size());
        assertBlock(result.blockStartingAt(0), 0, 4, to(5));
        assertBlock(result.blockStartingAt(5), 5, 8, to(9), to(5));
        Assert.assertNull(result.blockAt(9));
        Assert.assertEquals(Collections.singleton(9L), result.danglingSuccessors());
    }

    @Test
    public void testBranchToEntryPointNeedsNoSplit() throws Exception {
        // 0: NOP, 1: JZ 0, 3: RET
        final TraceResult result = tracer(image(4, 0, NOP, JZ, 0, RET)).run(0);

        Assert.assertEquals(2, result.getBlocks().size());
        assertBlock(result.blockStartingAt(0), 0, 2, to(3), to(0));
        assertBlock(result.blockStartingAt(3), 3, 3);
    }

    @Test
    public void testForwardBranchIntoScannedCodeSplitsBlock() throws Exception {
        // 0: JZ 8, 2..5 NOP, 6: RET; 8: JMP 4
        final byte[] image = image(10, 0, JZ, 8);
        put(image, 6, RET);
        put(image, 8, JMP, 4);
        final TraceResult result = tracer(image).run(0);

        assertBlock(result.blockStartingAt(0), 0, 1, to(2), to(8));
        assertBlock(result.blockStartingAt(8), 8, 9, to(4));
        assertBlock(result.blockStartingAt(2), 2, 3, to(4));
        assertBlock(result.blockStartingAt(4), 4, 6);
        Assert.assertEquals(4, result.getBlocks().size());
    }

    @Test
    public void testScanFallingIntoKnownCodeStops() throws Exception {
        // 0: CALL 6, 2: RET; 4: NOP, 5: NOP, 6: NOP, 7: RET
        final byte[] image = image(8, 0, CALL, 6, RET);
        put(image, 7, RET);
        final ExecTracer tracer = tracer(image);
        tracer.run(0);
        final TraceResult result = tracer.run(4);

        assertBlock(result.blockStartingAt(4), 4, 5, to(6));
        assertBlock(result.blockStartingAt(6), 6, 7);
        Assert.assertEquals(4, result.getBlocks().size());
        Assert.assertFalse(result.getDisassembly().containsKey(3L));
    }

    @Test
    public void testIllegalOpcodeHaltsTrace() throws Exception {
        // 0: CALL 16, 2: RET (pending when the trace stops), 16..19 NOP, 20: illegal
        final byte[] image = image(24, 0, CALL, 16, RET);
        put(image, 20, 0xFF);
        final ExecTracer tracer = tracer(image);

        try {
            tracer.run(0);
            Assert.fail("illegal opcode must stop the trace");
        } catch(IllegalInstructionException e) {
            Assert.assertEquals(20, e.getAddress());
            Assert.assertEquals(0xFF, e.getOpcode());
        }

        final TraceResult result = tracer.result();
        assertBlock(result.blockStartingAt(16), 16, 20, Successor.terminal("Illegal Opcode: 0xff"));
        Assert.assertNull(result.blockAt(2));
        Assert.assertTrue(tracer.getPendingEntryPoints().isEmpty());
        Assert.assertTrue(tracer.isHalted());
    }

    @Test(expected = IllegalStateException.class)
    public void testHaltedTracerRefusesToRun() throws Exception {
        final ExecTracer tracer = tracer(image(2, 0, 0xFF));
        try {
            tracer.run(0);
        } catch(IllegalInstructionException e) {
            // expected
        }
        tracer.run(1);
    }

    @Test
    public void testRunningOffTheImageFails() throws Exception {
        final ExecTracer tracer = tracer(image(3, 0, NOP, NOP, NOP));
        try {
            tracer.run(0);
            Assert.fail("scan past the end must fail");
        } catch(AddressOutOfRangeException e) {
            Assert.assertEquals(3, e.getAddress());
        }
        Assert.assertTrue(tracer.result().getBlocks().isEmpty());
        Assert.assertTrue(tracer.result().getDisassembly().isEmpty());
    }

    @Test
    public void testLaterEntryPointSplitsBlock() throws Exception {
        final byte[] image = image(21, 20, RET);
        final ExecTracer tracer = tracer(image);
        tracer.run(10);
        final TraceResult result = tracer.run(15);

        Assert.assertEquals(2, result.getBlocks().size());
        assertBlock(result.blockStartingAt(10), 10, 14, to(15));
        assertBlock(result.blockStartingAt(15), 15, 20);
    }

    @Test
    public void testEarlierResultSurvivesLaterRun() throws Exception {
        final ExecTracer tracer = tracer(image(21, 20, RET));
        final TraceResult first = tracer.run(10);
        tracer.run(15);

        assertBlock(first.blockAt(12), 10, 20);
        Assert.assertEquals(1, first.getBlocks().size());
        Assert.assertEquals(11, first.codeSize());
    }

    @Test
    public void testSplittingReturnedBlockLeavesTracerAlone() throws Exception {
        final ExecTracer tracer = tracer(image(21, 20, RET));
        final TraceResult result = tracer.run(10);

        final CodeBlock head = result.getBlocks().get(0).splitAt(15);
        assertBlock(head, 10, 14, to(15));

        assertBlock(tracer.result().blockAt(12), 10, 20);
        assertBlock(tracer.result().blockStartingAt(10), 10, 20);
    }

    @Test
    public void testOperandFetchIntoKnownCodeDropsPartialInstruction() throws Exception {
        // 0: CALL 5, 2: RET, 3: NOP, 4: LDI whose operand byte 5 is the NOP of the subroutine, 6: RET
        final byte[] image = image(7, 0, CALL, 5, RET, NOP, LDI, NOP, RET);
        final ExecTracer tracer = tracer(image);
        tracer.run(0);
        final TraceResult result = tracer.run(4);

        assertBlock(result.blockStartingAt(4), 4, 4, to(5));
        assertBlock(result.blockStartingAt(5), 5, 6);
        Assert.assertFalse(result.getDisassembly().containsKey(4L));
        Assert.assertFalse(result.getInstructionSizes().containsKey(4L));
        final List<Long> starts = Arrays.asList(result.getDisassembly().keySet().toArray(new Long[0]));
        Assert.assertEquals(Arrays.asList(0L, 2L, 5L, 6L), starts);
        Assert.assertEquals(Integer.valueOf(2), result.getInstructionSizes().get(0L));
        Assert.assertEquals(Integer.valueOf(1), result.getInstructionSizes().get(5L));
    }

    @Test
    public void testDecoderConsumingNothingFails() throws Exception {
        final Disassembler stuck = new Disassembler() {
            @Override
            public String getName() { return "stuck"; }

            @Override
            public DecodedInstr disassemble(InstructionCursor cursor) {
                return new DecodedInstr(cursor.instructionAddress(), "NOP", Flow.sequential());
            }
        };
        final ExecTracer tracer = new ExecTracer(new BinaryCodeChunk(new byte[4]), stuck);
        try {
            tracer.run(0);
            Assert.fail("a decoder that consumes no bytes must stop the trace");
        } catch(ExecTraceException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("stuck"));
        }
        Assert.assertTrue(tracer.isHalted());
        Assert.assertTrue(tracer.result().getBlocks().isEmpty());
        Assert.assertTrue(tracer.result().getDisassembly().isEmpty());
    }

    @Test
    public void testSplitHandsCallToHead() throws Exception {
        // 0: CALL 8, 2: RET; 8: RET. Entering at 1 later splits the caller.
        final byte[] image = image(9, 0, CALL, 8, RET);
        put(image, 8, RET);
        final ExecTracer tracer = tracer(image);
        tracer.run(0);
        final TraceResult result = tracer.run(1);

        final CodeBlock head = result.blockStartingAt(0);
        assertBlock(head, 0, 0, to(1));
        Assert.assertEquals(Collections.singletonMap(0L, 8L), head.getCalls());
        final CodeBlock tail = result.blockStartingAt(1);
        assertBlock(tail, 1, 1, to(2), to(8));
        Assert.assertTrue(tail.getCalls().isEmpty());
    }

    @Test
    public void testCallBackIntoOwnBlockSplitsIt() throws Exception {
        // 0: NOP, 1: NOP, 2: CALL 1, 4: RET
        final TraceResult result = tracer(image(5, 0, NOP, NOP, CALL, 1, RET)).run(0);

        assertBlock(result.blockStartingAt(0), 0, 0, to(1));
        final CodeBlock callee = result.blockStartingAt(1);
        assertBlock(callee, 1, 3, to(4), to(1));
        Assert.assertEquals(Collections.singletonMap(2L, 1L), callee.getCalls());
        assertBlock(result.blockStartingAt(4), 4, 4);
    }

    @Test
    public void testSchedulingIsIdempotent() throws Exception {
        final ExecTracer tracer = tracer(image(8, 7, RET));
        tracer.scheduleEntryPoint(5);
        tracer.scheduleEntryPoint(5);
        Assert.assertEquals(Collections.singletonList(5L), tracer.getPendingEntryPoints());

        tracer.run(Collections.<Long>emptyList());
        Assert.assertEquals(1, tracer.result().getBlocks().size());

        tracer.scheduleEntryPoint(5);
        tracer.scheduleEntryPoint(6);
        tracer.scheduleEntryPoint(6);
        Assert.assertTrue(tracer.getPendingEntryPoints().isEmpty());
        Assert.assertEquals(2, tracer.result().getBlocks().size());
    }

    @Test
    public void testSeveralEntryPoints() throws Exception {
        final byte[] image = image(8, 0, RET);
        put(image, 4, LDI, 9, RET);
        final TraceResult result = tracer(image).run(Arrays.asList(0L, 4L, 0L));

        assertBlock(result.blockStartingAt(0), 0, 0);
        assertBlock(result.blockStartingAt(4), 4, 6);
        Assert.assertEquals("LDI 0x9", result.getDisassembly().get(4L));
        final List<Long> starts = Arrays.asList(result.getDisassembly().keySet().toArray(new Long[0]));
        Assert.assertEquals(Arrays.asList(0L, 4L, 6L), starts);
    }
}
