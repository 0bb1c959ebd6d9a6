package org.boblycat.exectrace.plugin.disassembler.i8080;

import org.boblycat.exectrace.core.AddressOutOfRangeException;
import org.boblycat.exectrace.core.disassembler.DecodedInstr;
import org.boblycat.exectrace.core.disassembler.Disassembler;
import org.boblycat.exectrace.core.disassembler.DisassemblerFactory;
import org.boblycat.exectrace.core.disassembler.Flow;
import org.boblycat.exectrace.core.disassembler.InstructionCursor;

/**
 * Intel 8080 decoder.
 * <p/>
 * Opcodes are split into the usual <code>xx yyy zzz</code> fields. Operands
 * are little-endian. Conditional returns continue sequentially, since the
 * path that does not return goes on to the next instruction. <code>PCHL</code>
 * jumps through HL and <code>HLT</code> stops until an interrupt; both end
 * the path. The undocumented aliases are reported as illegal.
 * <p/>
 * Created: Mar 22, 2010
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class I8080Disasm implements Disassembler {

    public static final String NAME = "i8080";

    private static final String[] REG = { "B", "C", "D", "E", "H", "L", "M", "A" };
    private static final String[] REG_PAIR = { "B", "D", "H", "SP" };
    private static final String[] REG_PAIR_STACK = { "B", "D", "H", "PSW" };
    private static final String[] CONDITION = { "NZ", "Z", "NC", "C", "PO", "PE", "P", "M" };
    private static final String[] ALU = { "ADD", "ADC", "SUB", "SBB", "ANA", "XRA", "ORA", "CMP" };
    private static final String[] ALU_IMMEDIATE = { "ADI", "ACI", "SUI", "SBI", "ANI", "XRI", "ORI", "CPI" };
    private static final String[] ROTATE_AND_FLAGS = { "RLC", "RRC", "RAL", "RAR", "DAA", "CMA", "STC", "CMC" };
    private static final String[] MISC = { "JMP", null, "OUT", "IN", "XTHL", "XCHG", "DI", "EI" };

    public static void register() {
        DisassemblerFactory.addDisassembler(new I8080Disasm());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DecodedInstr disassemble(InstructionCursor cursor) throws AddressOutOfRangeException {
        final long address = cursor.instructionAddress();
        final int opcode = cursor.fetch();
        final int x = opcode >> 6;
        final int y = (opcode >> 3) & 7;
        final int z = opcode & 7;
        final int p = y >> 1;
        final int q = y & 1;

        switch(x) {
            case 0:
                return decodeLowQuarter(cursor, address, opcode, y, z, p, q);
            case 1:
                if(opcode == 0x76) {
                    return new DecodedInstr(address, "HLT", Flow.subroutineReturn());
                }
                return new DecodedInstr(address, "MOV", REG[y] + "," + REG[z], Flow.sequential());
            case 2:
                return new DecodedInstr(address, ALU[y], REG[z], Flow.sequential());
            default:
                return decodeHighQuarter(cursor, address, opcode, y, z, p, q);
        }
    }

    private DecodedInstr decodeLowQuarter(InstructionCursor cursor, long address, int opcode,
                                          int y, int z, int p, int q) throws AddressOutOfRangeException {
        switch(z) {
            case 0:
                if(y == 0) {
                    return new DecodedInstr(address, "NOP", Flow.sequential());
                }
                return illegal(address, opcode);
            case 1:
                if(q == 0) {
                    return new DecodedInstr(address, "LXI", REG_PAIR[p] + "," + word(cursor.fetchWord()), Flow.sequential());
                }
                return new DecodedInstr(address, "DAD", REG_PAIR[p], Flow.sequential());
            case 2:
                return decodeLoadStore(cursor, address, p, q);
            case 3:
                return new DecodedInstr(address, q == 0 ? "INX" : "DCX", REG_PAIR[p], Flow.sequential());
            case 4:
                return new DecodedInstr(address, "INR", REG[y], Flow.sequential());
            case 5:
                return new DecodedInstr(address, "DCR", REG[y], Flow.sequential());
            case 6:
                return new DecodedInstr(address, "MVI", REG[y] + "," + data(cursor.fetch()), Flow.sequential());
            default:
                return new DecodedInstr(address, ROTATE_AND_FLAGS[y], Flow.sequential());
        }
    }

    private DecodedInstr decodeLoadStore(InstructionCursor cursor, long address, int p, int q)
            throws AddressOutOfRangeException {
        switch(p) {
            case 0:
            case 1:
                return new DecodedInstr(address, q == 0 ? "STAX" : "LDAX", REG_PAIR[p], Flow.sequential());
            case 2:
                return new DecodedInstr(address, q == 0 ? "SHLD" : "LHLD", word(cursor.fetchWord()), Flow.sequential());
            default:
                return new DecodedInstr(address, q == 0 ? "STA" : "LDA", word(cursor.fetchWord()), Flow.sequential());
        }
    }

    private DecodedInstr decodeHighQuarter(InstructionCursor cursor, long address, int opcode,
                                           int y, int z, int p, int q) throws AddressOutOfRangeException {
        switch(z) {
            case 0:
                return new DecodedInstr(address, "R" + CONDITION[y], Flow.sequential());
            case 1:
                if(q == 0) {
                    return new DecodedInstr(address, "POP", REG_PAIR_STACK[p], Flow.sequential());
                }
                switch(p) {
                    case 0:
                        return new DecodedInstr(address, "RET", Flow.subroutineReturn());
                    case 1:
                        return illegal(address, opcode);
                    case 2:
                        return new DecodedInstr(address, "PCHL", Flow.subroutineReturn());
                    default:
                        return new DecodedInstr(address, "SPHL", Flow.sequential());
                }
            case 2: {
                final int target = cursor.fetchWord();
                return new DecodedInstr(address, "J" + CONDITION[y], word(target), Flow.conditionalBranch(target));
            }
            case 3:
                return decodeMisc(cursor, address, opcode, y);
            case 4: {
                final int target = cursor.fetchWord();
                return new DecodedInstr(address, "C" + CONDITION[y], word(target), Flow.call(target));
            }
            case 5:
                if(q == 0) {
                    return new DecodedInstr(address, "PUSH", REG_PAIR_STACK[p], Flow.sequential());
                }
                if(p == 0) {
                    final int target = cursor.fetchWord();
                    return new DecodedInstr(address, "CALL", word(target), Flow.call(target));
                }
                return illegal(address, opcode);
            case 6:
                return new DecodedInstr(address, ALU_IMMEDIATE[y], data(cursor.fetch()), Flow.sequential());
            default:
                return new DecodedInstr(address, "RST", Integer.toString(y), Flow.call(y * 8));
        }
    }

    private DecodedInstr decodeMisc(InstructionCursor cursor, long address, int opcode, int y)
            throws AddressOutOfRangeException {
        switch(y) {
            case 0: {
                final int target = cursor.fetchWord();
                return new DecodedInstr(address, MISC[y], word(target), Flow.unconditionalJump(target));
            }
            case 1:
                return illegal(address, opcode);
            case 2:
            case 3:
                return new DecodedInstr(address, MISC[y], data(cursor.fetch()), Flow.sequential());
            default:
                return new DecodedInstr(address, MISC[y], Flow.sequential());
        }
    }

    private static DecodedInstr illegal(long address, int opcode) {
        return new DecodedInstr(address, "db", data(opcode), Flow.illegal(opcode));
    }

    static String word(int value) {
        return String.format("0x%04X", value);
    }

    static String data(int value) {
        return String.format("0x%02X", value);
    }
}
