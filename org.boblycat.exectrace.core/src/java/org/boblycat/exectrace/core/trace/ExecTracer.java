package org.boblycat.exectrace.core.trace;

import org.boblycat.exectrace.core.AddressOutOfRangeException;
import org.boblycat.exectrace.core.BinaryCodeChunk;
import org.boblycat.exectrace.core.CodeBlock;
import org.boblycat.exectrace.core.ExecTraceException;
import org.boblycat.exectrace.core.IllegalInstructionException;
import org.boblycat.exectrace.core.PrintUtils;
import org.boblycat.exectrace.core.Successor;
import org.boblycat.exectrace.core.disassembler.DecodedInstr;
import org.boblycat.exectrace.core.disassembler.Disassembler;
import org.boblycat.exectrace.core.disassembler.Flow;
import org.boblycat.exectrace.core.disassembler.InstructionCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Maps every code path reachable from a set of entry points by decoding
 * instructions linearly and following each statically known branch,
 * without executing anything.
 * <p/>
 * Each linear scan becomes a {@link CodeBlock}. When a scan walks into
 * memory that an earlier scan already covered, the scan stops there and
 * the covering block is split so that block boundaries always line up
 * with every known entry. The blocks therefore never overlap, and an
 * address is scanned at most once.
 * <p/>
 * A tracer owns its worklist and block set. Successive runs accumulate
 * into the same result; a run cannot be started from inside another one,
 * and an illegal instruction or out-of-range fetch halts the tracer for
 * good.
 * <p/>
 * Created: Mar 19, 2010
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class ExecTracer {

    private static final Logger logger = LoggerFactory.getLogger(ExecTracer.class);

    private final BinaryCodeChunk image;
    private final Disassembler disassembler;

    /** Closed blocks keyed by start address. */
    private final TreeMap<Long, CodeBlock> visitedRanges = new TreeMap<Long, CodeBlock>();
    private final Deque<Long> pendingEntryPoints = new ArrayDeque<Long>();
    private final SortedMap<Long, String> disasm = new TreeMap<Long, String>();
    private final SortedMap<Long, Integer> sizes = new TreeMap<Long, Integer>();

    private boolean scanning = false;
    private long currentEntryPoint;
    private long pc;

    private boolean running = false;
    private boolean halted = false;

    public ExecTracer(BinaryCodeChunk image, Disassembler disassembler) {
        this.image = image;
        this.disassembler = disassembler;
    }

    public TraceResult run(long entryPoint) throws ExecTraceException {
        return run(Collections.singletonList(entryPoint));
    }

    /**
     * Traces every path reachable from <code>entryPoints</code>.
     *
     * @throws IllegalInstructionException if an opcode cannot be decoded;
     *         the blocks found so far stay available through {@link #result()}
     * @throws AddressOutOfRangeException if a scan runs off the image
     */
    public TraceResult run(Collection<Long> entryPoints) throws ExecTraceException {
        if(running) {
            throw new IllegalStateException("A trace is already running on this tracer");
        }
        if(halted) {
            throw new IllegalStateException("Tracer halted by an earlier error; create a new one");
        }
        running = true;
        try {
            for(Long entryPoint : entryPoints) {
                scheduleEntryPoint(entryPoint);
            }
            restartFromAnotherEntryPoint();
            while(scanning) {
                step();
            }
        } catch(ExecTraceException e) {
            halt();
            throw e;
        } finally {
            running = false;
        }
        logRanges();
        return result();
    }

    public TraceResult result() {
        return new TraceResult(image, visitedRanges.values(), disasm, sizes);
    }

    public boolean isHalted() { return halted; }

    /** Entry points scheduled but not yet scanned, next one first. */
    public List<Long> getPendingEntryPoints() {
        return new ArrayList<Long>(pendingEntryPoints);
    }

    private void step() throws ExecTraceException {
        final long address = pc;
        final ScanCursor cursor = new ScanCursor(address);
        final DecodedInstr instr = disassembler.disassemble(cursor);
        if(cursor.interrupted) {
            return;
        }
        if(cursor.consumed == 0) {
            throw new ExecTraceException(String.format("%s consumed no bytes at %s",
                                                       disassembler.getName(), PrintUtils.toHex(address)));
        }
        disasm.put(address, instr.text());
        sizes.put(address, cursor.consumed);
        logger.trace("{}: {}", PrintUtils.toHex(address), instr);

        final Flow flow = instr.flow();
        switch(flow.getKind()) {
            case SEQUENTIAL:
                break;
            case CALL:
                subroutine(address, flow.getTarget());
                break;
            case RETURN:
                returnFromSubroutine();
                break;
            case CONDITIONAL_BRANCH:
                logger.debug("Conditional branch to {}", PrintUtils.toHex(flow.getTarget()));
                branch(flow.getTarget(), true);
                break;
            case UNCONDITIONAL_JUMP:
                logger.debug("Unconditional jump to {}", PrintUtils.toHex(flow.getTarget()));
                branch(flow.getTarget(), false);
                break;
            case ILLEGAL:
                illegalInstruction(address, flow.getOpcode());
                break;
            default:
                throw new IllegalStateException("Unknown flow " + flow);
        }
    }

    private void subroutine(long callSite, long routine) {
        final long returnAddress = pc;
        final CodeBlock block = closeScan(Successor.to(returnAddress), Successor.to(routine));
        block.addSubroutineCall(callSite, routine);
        logger.debug("Call to subroutine at {}", PrintUtils.toHex(routine));
        scheduleEntryPoint(returnAddress);
        scheduleEntryPoint(routine);
        restartFromAnotherEntryPoint();
    }

    private void returnFromSubroutine() {
        closeScan();
        logger.debug("Return from subroutine");
        restartFromAnotherEntryPoint();
    }

    /*
     * A target strictly inside the scan cuts it retroactively: the part
     * before the target and the loop body become separate blocks. A target
     * equal to the entry point already is a boundary.
     */
    private void branch(long target, boolean conditional) {
        final long next = pc;
        if(target > currentEntryPoint && target < pc) {
            addRange(currentEntryPoint, target - 1, Successor.to(target));
            addRange(target, pc - 1, Successor.to(next), Successor.to(target));
            scanning = false;
            if(conditional) {
                scheduleEntryPoint(next);
            }
        } else {
            if(conditional) {
                closeScan(Successor.to(next), Successor.to(target));
                scheduleEntryPoint(next);
            } else {
                closeScan(Successor.to(target));
            }
            scheduleEntryPoint(target);
        }
        restartFromAnotherEntryPoint();
    }

    private void illegalInstruction(long address, int opcode) throws IllegalInstructionException {
        closeScan(Successor.terminal("Illegal Opcode: " + PrintUtils.toHex(opcode)));
        final IllegalInstructionException e = new IllegalInstructionException(address, opcode);
        logger.error(e.getMessage());
        throw e;
    }

    private void halt() {
        if(scanning) {
            // partial scan: keep coverage consistent with the block set
            disasm.subMap(currentEntryPoint, pc).clear();
            sizes.subMap(currentEntryPoint, pc).clear();
            scanning = false;
        }
        if(!pendingEntryPoints.isEmpty()) {
            logger.info("Abandoning {} pending entry points", pendingEntryPoints.size());
            pendingEntryPoints.clear();
        }
        halted = true;
    }

    /**
     * Tells whether <code>address</code> was already scanned, either by the
     * live scan or as part of a closed block. A closed block that contains
     * the address past its start is split there.
     */
    boolean alreadyVisited(long address) {
        if(scanning && address >= currentEntryPoint && address < pc) {
            logger.trace("{} lies in the current scan (pc={})", PrintUtils.toHex(address), PrintUtils.toHex(pc));
            return true;
        }

        final Map.Entry<Long, CodeBlock> floor = visitedRanges.floorEntry(address);
        if(floor == null || !floor.getValue().contains(address)) {
            return false;
        }
        final CodeBlock block = floor.getValue();
        logger.trace("{} already visited in {}", PrintUtils.toHex(address), block);
        if(address > block.getStart()) {
            final CodeBlock head = block.splitAt(address);
            visitedRanges.put(head.getStart(), head);
            visitedRanges.put(block.getStart(), block);
        }
        return true;
    }

    void scheduleEntryPoint(long address) {
        if(alreadyVisited(address)) {
            return;
        }
        if(!pendingEntryPoints.contains(address)) {
            pendingEntryPoints.push(address);
            logger.debug("Scheduling {}", PrintUtils.toHex(address));
            logger.trace("Pending: {}", PrintUtils.toHexList(pendingEntryPoints));
        }
    }

    private void restartFromAnotherEntryPoint() {
        if(pendingEntryPoints.isEmpty()) {
            scanning = false;
            return;
        }
        final long address = pendingEntryPoints.pop();
        currentEntryPoint = address;
        pc = address;
        scanning = true;
        logger.debug("Restarting from {}", PrintUtils.toHex(address));
    }

    /** Closes the live scan as <code>[entry, pc-1]</code>. */
    private CodeBlock closeScan(Successor... successors) {
        final CodeBlock block = addRange(currentEntryPoint, pc - 1, successors);
        scanning = false;
        return block;
    }

    private CodeBlock addRange(long start, long end, Successor... successors) {
        final CodeBlock block = new CodeBlock(start, end, successors);
        if(visitedRanges.containsKey(start)) {
            throw new IllegalStateException("Overlapping block at " + PrintUtils.toHex(start));
        }
        visitedRanges.put(start, block);
        logger.trace("New range {}", block);
        return block;
    }

    /**
     * Advances past the byte just fetched, unless that byte belongs to
     * code explored by an earlier scan; then the live scan falls into that
     * code and ends.
     *
     * @return false if the scan was abandoned
     */
    private boolean incrementPC() {
        if(alreadyVisited(pc)) {
            logger.debug("Reached known code at {}", PrintUtils.toHex(pc));
            if(pc > currentEntryPoint) {
                closeScan(Successor.to(pc));
            } else {
                scanning = false;
            }
            restartFromAnotherEntryPoint();
            return false;
        }
        pc++;
        return true;
    }

    private void logRanges() {
        if(!logger.isTraceEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder("ranges:");
        for(CodeBlock block : visitedRanges.values()) {
            sb.append("\n  ").append(block.getRange());
        }
        logger.trace(sb.toString());
    }

    /*
     * Reads through the tracer's program counter. Once the scan is
     * interrupted every further fetch returns 0 and leaves the tracer alone.
     */
    private class ScanCursor implements InstructionCursor {
        private final long instructionAddress;
        boolean interrupted = false;
        int consumed = 0;

        ScanCursor(long instructionAddress) {
            this.instructionAddress = instructionAddress;
        }

        @Override
        public long instructionAddress() { return instructionAddress; }

        @Override
        public long address() { return instructionAddress + consumed; }

        @Override
        public int fetch() throws AddressOutOfRangeException {
            if(interrupted) {
                return 0;
            }
            final int value = image.fetch(pc);
            logger.trace("Fetch at {}: {}", PrintUtils.toHex(pc), PrintUtils.toByte(value));
            consumed++;
            if(!incrementPC()) {
                interrupted = true;
            }
            return value;
        }

        @Override
        public int fetchWord() throws AddressOutOfRangeException {
            final int lo = fetch();
            final int hi = fetch();
            return lo | (hi << 8);
        }
    }
}
