package org.boblycat.exectrace.core;

/**
 * Outgoing edge of a {@link CodeBlock}: either the address of the code
 * that may run next, or a terminal marker explaining why there is none.
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public final class Successor {

    private final long address;
    private final String diagnostic;

    private Successor(long address, String diagnostic) {
        this.address = address;
        this.diagnostic = diagnostic;
    }

    public static Successor to(long address) {
        return new Successor(address, null);
    }

    public static Successor terminal(String diagnostic) {
        if(diagnostic == null) {
            throw new IllegalArgumentException("A terminal marker needs a diagnostic");
        }
        return new Successor(-1, diagnostic);
    }

    public boolean isTerminal() { return diagnostic != null; }

    public long getAddress() {
        if(isTerminal()) {
            throw new IllegalStateException("Terminal marker has no address: " + diagnostic);
        }
        return address;
    }

    public String getDiagnostic() { return diagnostic; }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Successor)) return false;
        final Successor other = (Successor)o;
        if(isTerminal()) {
            return diagnostic.equals(other.diagnostic);
        }
        return !other.isTerminal() && address == other.address;
    }

    @Override
    public int hashCode() {
        return isTerminal() ? diagnostic.hashCode() : Long.valueOf(address).hashCode();
    }

    @Override
    public String toString() {
        return isTerminal() ? diagnostic : PrintUtils.toHex(address);
    }
}
