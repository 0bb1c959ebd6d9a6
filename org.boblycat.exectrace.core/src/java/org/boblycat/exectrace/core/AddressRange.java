package org.boblycat.exectrace.core;

/**
 * Inclusive address interval.
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public final class AddressRange implements Comparable<AddressRange> {

    private final long start;
    private final long end;

    public AddressRange(long start, long end) {
        if(end < start) {
            throw new IllegalArgumentException(String.format("Empty range [%s, %s]",
                                                             PrintUtils.toHex(start), PrintUtils.toHex(end)));
        }
        this.start = start;
        this.end = end;
    }

    public long getStart() { return start; }
    public long getEnd() { return end; }
    public long length() { return end - start + 1; }

    public boolean contains(long address) {
        return address >= start && address <= end;
    }

    public boolean intersects(AddressRange other) {
        return start <= other.end && other.start <= end;
    }

    @Override
    public int compareTo(AddressRange other) {
        if(start != other.start) {
            return start < other.start ? -1 : 1;
        }
        return end < other.end ? -1 : (end == other.end ? 0 : 1);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof AddressRange)) return false;
        final AddressRange other = (AddressRange)o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return (int)(start * 31 + end);
    }

    @Override
    public String toString() {
        return String.format("[start: %s, end: %s]", PrintUtils.toHex(start), PrintUtils.toHex(end));
    }
}
