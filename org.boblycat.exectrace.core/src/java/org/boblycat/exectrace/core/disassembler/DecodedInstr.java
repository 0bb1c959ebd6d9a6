package org.boblycat.exectrace.core.disassembler;

/**
 * Created: Mar 20, 2010
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class DecodedInstr implements Instr {

    private final long address;
    private final String instruction;
    private final String args;
    private final Flow flow;

    public DecodedInstr(long address, String instruction, String args, Flow flow) {
        this.address = address;
        this.instruction = instruction;
        this.args = args == null ? "" : args;
        this.flow = flow;
    }

    public DecodedInstr(long address, String instruction, Flow flow) {
        this(address, instruction, "", flow);
    }

    @Override public String instruction() { return instruction; }
    @Override public long address() { return address; }
    @Override public String args() { return args; }
    @Override public Flow flow() { return flow; }

    /** Listing form, mnemonic followed by its operands. */
    public String text() {
        return args.isEmpty() ? instruction : instruction + " " + args;
    }

    @Override
    public String toString() {
        return text();
    }
}
