package org.boblycat.exectrace.core.disassembler;

public interface Instr {

	public abstract String instruction();
    public abstract long address();
    public abstract String args();
    public abstract Flow flow();
}
