package org.boblycat.exectrace.tool;

import org.boblycat.exectrace.core.AddressRange;
import org.boblycat.exectrace.core.BinaryCodeChunk;
import org.boblycat.exectrace.core.ExecTraceException;
import org.boblycat.exectrace.core.disassembler.Disassembler;
import org.boblycat.exectrace.core.disassembler.DisassemblerFactory;
import org.boblycat.exectrace.core.graph.FlowGraphExporter;
import org.boblycat.exectrace.core.listing.ListingWriter;
import org.boblycat.exectrace.core.trace.ExecTracer;
import org.boblycat.exectrace.core.trace.TraceResult;
import org.boblycat.exectrace.plugin.disassembler.i8080.I8080Disasm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Traces a ROM image and writes its listing and flow graph.
 * <p/>
 * Created: Mar 12, 2010
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class ExecTraceMain {

    static final int EXIT_OK = 0;
    static final int EXIT_TRACE_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        final TraceOptions options;
        try {
            options = TraceOptions.parse(args);
        } catch(ExecTraceException e) {
            err.println(e.getMessage());
            err.print(TraceOptions.USAGE);
            return EXIT_USAGE;
        }
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", options.logLevel());
        final Logger logger = LoggerFactory.getLogger(ExecTraceMain.class);

        I8080Disasm.register();
        final Disassembler disassembler = DisassemblerFactory.create(options.getDisassembler());
        if(disassembler == null) {
            err.println("Unknown disassembler " + options.getDisassembler()
                        + ", known: " + DisassemblerFactory.knownMachines());
            return EXIT_USAGE;
        }

        final BinaryCodeChunk image;
        try {
            image = BinaryCodeChunk.load(options.getRomFile(), options.getBank());
        } catch(ExecTraceException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch(IOException e) {
            logger.error("Cannot read " + options.getRomFile(), e);
            return EXIT_TRACE_FAILED;
        }

        final ExecTracer tracer = new ExecTracer(image, disassembler);
        int status = EXIT_OK;
        TraceResult result;
        try {
            result = tracer.run(options.getEntryPoints());
        } catch(ExecTraceException e) {
            logger.error("Trace stopped: " + e.getMessage());
            result = tracer.result();
            status = EXIT_TRACE_FAILED;
        }

        out.println("code ranges:");
        for(AddressRange range : result.groupedRanges()) {
            out.println("  " + range);
        }

        try {
            new ListingWriter(String.format("; %s, bank %d, %s\n", options.getRomFile(),
                                            options.getBank(), disassembler.getName()))
                    .writeTo(result, options.getListingFile());
            if(options.getGraphFile() != null) {
                new FlowGraphExporter().writeTo(result, options.getGraphFile());
            }
        } catch(IOException e) {
            logger.error("Cannot write output", e);
            return EXIT_TRACE_FAILED;
        } catch(ExecTraceException e) {
            logger.error("Cannot write listing: " + e.getMessage());
            return EXIT_TRACE_FAILED;
        }
        return status;
    }
}
