package org.boblycat.exectrace.core.disassembler;

import org.boblycat.exectrace.core.ExecTraceException;

/**
 * Instruction set specific decoder used by the tracer.
 * <p/>
 * An implementation reads the bytes of exactly one instruction through
 * the cursor and describes where control goes afterwards in the returned
 * {@link Flow}. It must not read beyond the instruction.
 */
public interface Disassembler {

    String getName();

    DecodedInstr disassemble(InstructionCursor cursor) throws ExecTraceException;
}
