package org.boblycat.exectrace.core.trace;

import org.boblycat.exectrace.core.AddressRange;
import org.boblycat.exectrace.core.BinaryCodeChunk;
import org.boblycat.exectrace.core.CodeBlock;
import org.boblycat.exectrace.core.Successor;

import java.util.*;

/**
 * Snapshot of what a tracer has found so far: the block graph, the text of every
 * decoded instruction, and the image it was read from.
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class TraceResult {

    private final BinaryCodeChunk image;
    private final List<CodeBlock> blocks;
    private final TreeMap<Long, CodeBlock> blocksByStart = new TreeMap<Long, CodeBlock>();
    private final SortedMap<Long, String> disassembly;
    private final SortedMap<Long, Integer> instructionSizes;

    /*
     * Blocks are copied: the tracer keeps splitting its own as later runs
     * find new entries.
     */
    TraceResult(BinaryCodeChunk image, Collection<CodeBlock> blocks,
                SortedMap<Long, String> disassembly, SortedMap<Long, Integer> instructionSizes) {
        this.image = image;
        final List<CodeBlock> sorted = new ArrayList<CodeBlock>(blocks.size());
        for(CodeBlock block : blocks) {
            sorted.add(new CodeBlock(block));
        }
        Collections.sort(sorted);
        this.blocks = Collections.unmodifiableList(sorted);
        for(CodeBlock block : sorted) {
            blocksByStart.put(block.getStart(), block);
        }
        this.disassembly = Collections.unmodifiableSortedMap(new TreeMap<Long, String>(disassembly));
        this.instructionSizes = Collections.unmodifiableSortedMap(new TreeMap<Long, Integer>(instructionSizes));
    }

    public BinaryCodeChunk getImage() { return image; }

    /** All blocks, ordered by start address. */
    public List<CodeBlock> getBlocks() { return blocks; }

    /** Instruction text keyed by instruction address. */
    public SortedMap<Long, String> getDisassembly() { return disassembly; }

    /** Byte length of every decoded instruction, keyed like {@link #getDisassembly()}. */
    public SortedMap<Long, Integer> getInstructionSizes() { return instructionSizes; }

    /**
     * @return the block containing <code>address</code>, or null
     */
    public CodeBlock blockAt(long address) {
        final Map.Entry<Long, CodeBlock> floor = blocksByStart.floorEntry(address);
        if(floor == null || !floor.getValue().contains(address)) {
            return null;
        }
        return floor.getValue();
    }

    /**
     * @return the block starting exactly at <code>address</code>, or null
     */
    public CodeBlock blockStartingAt(long address) {
        return blocksByStart.get(address);
    }

    /**
     * Coalesces the blocks into the maximal intervals classified as code.
     * Touching blocks (the next one starting at or right after the end of
     * the current interval) are merged.
     */
    public List<AddressRange> groupedRanges() {
        final List<AddressRange> grouped = new ArrayList<AddressRange>();
        long start = -1;
        long end = -1;
        for(CodeBlock block : blocks) {
            if(start < 0) {
                start = block.getStart();
                end = block.getEnd();
            } else if(block.getStart() == end || block.getStart() == end + 1) {
                end = Math.max(end, block.getEnd());
            } else {
                grouped.add(new AddressRange(start, end));
                start = block.getStart();
                end = block.getEnd();
            }
        }
        if(start >= 0) {
            grouped.add(new AddressRange(start, end));
        }
        return grouped;
    }

    /** Number of bytes classified as code. */
    public long codeSize() {
        long size = 0;
        for(CodeBlock block : blocks) {
            size += block.length();
        }
        return size;
    }

    /**
     * Successor addresses that do not start any block: targets still pending
     * when a trace halted, and the fall-through named by an unconditional
     * backward jump, which is never scanned.
     */
    public SortedSet<Long> danglingSuccessors() {
        final SortedSet<Long> dangling = new TreeSet<Long>();
        for(CodeBlock block : blocks) {
            for(Successor successor : block.getSuccessors()) {
                if(!successor.isTerminal() && !blocksByStart.containsKey(successor.getAddress())) {
                    dangling.add(successor.getAddress());
                }
            }
        }
        return dangling;
    }
}
