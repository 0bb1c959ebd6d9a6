package org.boblycat.exectrace.core.disassembler;

import org.boblycat.exectrace.core.AddressOutOfRangeException;

/**
 * Sequential reader handed to a {@link Disassembler} for one instruction.
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public interface InstructionCursor {

    /** Address of the instruction being decoded. */
    long instructionAddress();

    /** Address of the next byte {@link #fetch()} will return. */
    long address();

    /** @return the next unsigned byte, advancing the cursor */
    int fetch() throws AddressOutOfRangeException;

    /** Little-endian 16-bit operand. */
    int fetchWord() throws AddressOutOfRangeException;
}
