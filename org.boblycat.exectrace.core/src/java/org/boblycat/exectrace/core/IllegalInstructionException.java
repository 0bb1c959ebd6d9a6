package org.boblycat.exectrace.core;

/**
 * Raised when the disassembler cannot decode the opcode at an address.
 * The trace stops; blocks found before the failure remain available.
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class IllegalInstructionException extends ExecTraceException {

    private static final long serialVersionUID = 8119625203329401862L;

    private final long address;
    private final int opcode;

    public IllegalInstructionException(long address, int opcode) {
        super(String.format("[%s] ILLEGAL: %s", PrintUtils.toHex(address), PrintUtils.toHex(opcode)));
        this.address = address;
        this.opcode = opcode;
    }

    public long getAddress() { return address; }
    public int getOpcode() { return opcode; }
}
