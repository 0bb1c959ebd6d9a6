package org.boblycat.exectrace.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A range of program memory explored in one linear scan.
 * <p/>
 * A block ending in a return has no successors. One ending in a jump has
 * a single successor, one ending in a conditional branch or a call has two
 * (the fall-through address first). A block stopped by an illegal opcode
 * has a single terminal marker.
 * <p/>
 * Created: Mar 19, 2010
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class CodeBlock implements Comparable<CodeBlock> {

    private long start;
    private long end;
    private final List<Successor> successors;
    private final SortedMap<Long, Long> calls = new TreeMap<Long, Long>();

    public CodeBlock(long start, long end, List<Successor> successors) {
        if(end < start) {
            throw new IllegalArgumentException(String.format("Block end %s before start %s",
                                                             PrintUtils.toHex(end), PrintUtils.toHex(start)));
        }
        if(successors.size() > 2) {
            throw new IllegalArgumentException("A block has at most two successors: " + successors);
        }
        this.start = start;
        this.end = end;
        this.successors = new ArrayList<Successor>(successors);
    }

    public CodeBlock(long start, long end, Successor... successors) {
        this(start, end, Arrays.asList(successors));
    }

    /** Independent copy, calls included. */
    public CodeBlock(CodeBlock other) {
        this(other.start, other.end, other.successors);
        calls.putAll(other.calls);
    }

    public long getStart() { return start; }
    public long getEnd() { return end; }
    public List<Successor> getSuccessors() { return Collections.unmodifiableList(successors); }
    public SortedMap<Long, Long> getCalls() { return Collections.unmodifiableSortedMap(calls); }
    public AddressRange getRange() { return new AddressRange(start, end); }
    public long length() { return end - start + 1; }

    public boolean contains(long address) {
        return address >= start && address <= end;
    }

    public boolean isReturn() { return successors.isEmpty(); }

    /**
     * Records that the instruction at <code>callSite</code> invokes the
     * subroutine at <code>routine</code>.
     */
    public void addSubroutineCall(long callSite, long routine) {
        if(!contains(callSite)) {
            throw new IllegalArgumentException(String.format("Call site %s outside %s",
                                                             PrintUtils.toHex(callSite), getRange()));
        }
        calls.put(callSite, routine);
    }

    /**
     * Cuts this block in two at <code>address</code>. The returned head
     * covers <code>[start, address-1]</code>, falls through into
     * <code>address</code> and takes the calls made below it; this block
     * keeps the tail and its original successors.
     */
    public CodeBlock splitAt(long address) {
        if(address <= start || address > end) {
            throw new IllegalArgumentException(String.format("Cannot split %s at %s",
                                                             getRange(), PrintUtils.toHex(address)));
        }
        final CodeBlock head = new CodeBlock(start, address - 1, Successor.to(address));
        final Iterator<Map.Entry<Long, Long>> it = calls.headMap(address).entrySet().iterator();
        while(it.hasNext()) {
            final Map.Entry<Long, Long> call = it.next();
            head.calls.put(call.getKey(), call.getValue());
            it.remove();
        }
        start = address;
        return head;
    }

    @Override
    public int compareTo(CodeBlock other) {
        return getRange().compareTo(other.getRange());
    }

    @Override
    public String toString() {
        return String.format("[start: %s, end: %s] -> %s", PrintUtils.toHex(start), PrintUtils.toHex(end), successors);
    }
}
