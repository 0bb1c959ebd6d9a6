package org.boblycat.exectrace.tool;

import org.boblycat.exectrace.core.ExecTraceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command line settings of the tracer.
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class TraceOptions {

    public static final String USAGE =
            "usage: exectrace <romfile> [-b bank] [-e entry]... [-d disassembler]\n" +
            "                 [-l listing.asm] [-g graph.gv] [-v|-vv]\n";

    private String romFile = null;
    private long bank = 0;
    private final List<Long> entryPoints = new ArrayList<Long>();
    private String disassembler = "i8080";
    private String listingFile = "output.asm";
    private String graphFile = null;
    private int verbosity = 0;

    public static TraceOptions parse(String[] args) throws ExecTraceException {
        final TraceOptions options = new TraceOptions();
        for(int i = 0; i < args.length; i++) {
            final String arg = args[i];
            if(arg.equals("-b")) {
                options.bank = parseNumber(value(args, ++i, arg));
            } else if(arg.equals("-e")) {
                options.entryPoints.add(parseNumber(value(args, ++i, arg)));
            } else if(arg.equals("-d")) {
                options.disassembler = value(args, ++i, arg);
            } else if(arg.equals("-l")) {
                options.listingFile = value(args, ++i, arg);
            } else if(arg.equals("-g")) {
                options.graphFile = value(args, ++i, arg);
            } else if(arg.equals("-v")) {
                options.verbosity = Math.max(options.verbosity, 1);
            } else if(arg.equals("-vv")) {
                options.verbosity = 2;
            } else if(arg.startsWith("-")) {
                throw new ExecTraceException("Unknown option " + arg);
            } else if(options.romFile == null) {
                options.romFile = arg;
            } else {
                throw new ExecTraceException("Unexpected argument " + arg);
            }
        }
        if(options.romFile == null) {
            throw new ExecTraceException("No ROM file given");
        }
        if(options.entryPoints.isEmpty()) {
            options.entryPoints.add(0L);
        }
        return options;
    }

    private static String value(String[] args, int index, String option) throws ExecTraceException {
        if(index >= args.length) {
            throw new ExecTraceException("Option " + option + " needs a value");
        }
        return args[index];
    }

    /** Decimal, or hexadecimal with a <code>0x</code> prefix. */
    static long parseNumber(String text) throws ExecTraceException {
        try {
            final long value;
            if(text.startsWith("0x") || text.startsWith("0X")) {
                value = Long.parseLong(text.substring(2), 16);
            } else {
                value = Long.parseLong(text);
            }
            if(value < 0) {
                throw new ExecTraceException("Negative address " + text);
            }
            return value;
        } catch(NumberFormatException e) {
            throw new ExecTraceException("Not a number: " + text, e);
        }
    }

    public String getRomFile() { return romFile; }
    public long getBank() { return bank; }
    public List<Long> getEntryPoints() { return Collections.unmodifiableList(entryPoints); }
    public String getDisassembler() { return disassembler; }
    public String getListingFile() { return listingFile; }
    public String getGraphFile() { return graphFile; }
    public int getVerbosity() { return verbosity; }

    /** SLF4J simple logger level matching the verbosity flags. */
    public String logLevel() {
        switch(verbosity) {
            case 0: return "warn";
            case 1: return "debug";
            default: return "trace";
        }
    }
}
