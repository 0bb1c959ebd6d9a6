package org.boblycat.exectrace.core.listing;

import org.boblycat.exectrace.core.AddressOutOfRangeException;
import org.boblycat.exectrace.core.BinaryCodeChunk;
import org.boblycat.exectrace.core.CodeBlock;
import org.boblycat.exectrace.core.PrintUtils;
import org.boblycat.exectrace.core.trace.TraceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Writes an assembly listing of a trace. Code blocks are printed from the
 * disassembly text; the bytes between them, never reached as code, are
 * printed as <code>db</code> data records, and so are bytes inside a block
 * that no decoded instruction covers.
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class ListingWriter {

    private static final Logger logger = LoggerFactory.getLogger(ListingWriter.class);

    static final int BYTES_PER_DATA_LINE = 8;
    static final String INDENT = "            ";

    private final String header;

    public ListingWriter(String header) {
        this.header = header == null ? "" : header;
    }

    public ListingWriter() {
        this("");
    }

    public void writeTo(TraceResult result, String fileName) throws IOException, AddressOutOfRangeException {
        final Writer out = new OutputStreamWriter(new FileOutputStream(new File(fileName)), StandardCharsets.UTF_8);
        try {
            write(result, out);
        } finally {
            out.close();
        }
    }

    public void write(TraceResult result, Writer out) throws IOException, AddressOutOfRangeException {
        final BinaryCodeChunk image = result.getImage();
        final SortedMap<Long, String> disasm = result.getDisassembly();
        final SortedMap<Long, Integer> sizes = result.getInstructionSizes();
        out.write(header);

        long nextAddress = 0;
        for(CodeBlock block : result.getBlocks()) {
            if(block.getStart() < nextAddress) {
                logger.warn("Skipping block {} overlapping the listing at {}",
                            block.getRange(), PrintUtils.toHex(nextAddress));
                continue;
            }
            if(block.getStart() > nextAddress) {
                writeData(image, nextAddress, block.getStart(), label(nextAddress), out);
            }

            final long blockEnd = block.getEnd() + 1;
            String indent = label(block.getStart());
            long address = block.getStart();
            while(address < blockEnd) {
                final String text = disasm.get(address);
                if(text != null) {
                    out.write(indent + text + "\n");
                    final Integer size = sizes.get(address);
                    address += size == null ? 1 : size;
                } else {
                    // bytes of the block with no decoded instruction, e.g. an interrupted fetch
                    final SortedMap<Long, String> rest = disasm.subMap(address, blockEnd);
                    final long to = rest.isEmpty() ? blockEnd : rest.firstKey();
                    writeData(image, address, to, indent, out);
                    address = to;
                }
                indent = INDENT;
            }
            nextAddress = blockEnd;
        }
        out.flush();
    }

    private static void writeData(BinaryCodeChunk image, long from, long to, String firstIndent, Writer out)
            throws IOException, AddressOutOfRangeException {
        String indent = firstIndent;
        final List<String> data = new ArrayList<String>(BYTES_PER_DATA_LINE);
        for(long address = from; address < to; address++) {
            data.add(PrintUtils.toByte(image.fetch(address)));
            if(data.size() == BYTES_PER_DATA_LINE) {
                out.write(indent + "db " + String.join(", ", data) + "\n");
                indent = INDENT;
                data.clear();
            }
        }
        if(!data.isEmpty()) {
            out.write(indent + "db " + String.join(", ", data) + "\n");
        }
    }

    static String label(long address) {
        return "LABEL_" + PrintUtils.toAddress(address) + ": ";
    }
}
