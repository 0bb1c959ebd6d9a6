package org.boblycat.exectrace.core.disassembler;

import org.boblycat.exectrace.core.PrintUtils;

/**
 * How control leaves a decoded instruction.
 * <p/>
 * Created: Mar 20, 2010
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public final class Flow {

    public enum Kind {
        SEQUENTIAL,
        CONDITIONAL_BRANCH,
        UNCONDITIONAL_JUMP,
        CALL,
        RETURN,
        ILLEGAL
    }

    private static final Flow SEQUENTIAL = new Flow(Kind.SEQUENTIAL, -1, -1);
    private static final Flow RETURN = new Flow(Kind.RETURN, -1, -1);

    private final Kind kind;
    private final long target;
    private final int opcode;

    private Flow(Kind kind, long target, int opcode) {
        this.kind = kind;
        this.target = target;
        this.opcode = opcode;
    }

    public static Flow sequential() { return SEQUENTIAL; }
    public static Flow subroutineReturn() { return RETURN; }
    public static Flow conditionalBranch(long target) { return new Flow(Kind.CONDITIONAL_BRANCH, target, -1); }
    public static Flow unconditionalJump(long target) { return new Flow(Kind.UNCONDITIONAL_JUMP, target, -1); }
    public static Flow call(long target) { return new Flow(Kind.CALL, target, -1); }
    public static Flow illegal(int opcode) { return new Flow(Kind.ILLEGAL, -1, opcode); }

    public Kind getKind() { return kind; }

    public boolean hasTarget() {
        return kind == Kind.CONDITIONAL_BRANCH || kind == Kind.UNCONDITIONAL_JUMP || kind == Kind.CALL;
    }

    public long getTarget() {
        if(!hasTarget()) {
            throw new IllegalStateException(kind + " has no target");
        }
        return target;
    }

    public int getOpcode() {
        if(kind != Kind.ILLEGAL) {
            throw new IllegalStateException(kind + " has no opcode");
        }
        return opcode;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Flow)) return false;
        final Flow other = (Flow)o;
        return kind == other.kind && target == other.target && opcode == other.opcode;
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + (int)target * 7 + opcode;
    }

    @Override
    public String toString() {
        if(hasTarget()) {
            return kind + "(" + PrintUtils.toHex(target) + ")";
        }
        if(kind == Kind.ILLEGAL) {
            return kind + "(" + PrintUtils.toHex(opcode) + ")";
        }
        return kind.toString();
    }
}
