package org.boblycat.exectrace.core.graph;

import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;
import org.boblycat.exectrace.core.CodeBlock;
import org.boblycat.exectrace.core.PrintUtils;
import org.boblycat.exectrace.core.Successor;
import org.boblycat.exectrace.core.trace.TraceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

import static guru.nidi.graphviz.model.Factory.mutGraph;
import static guru.nidi.graphviz.model.Factory.mutNode;

/**
 * Renders the block graph of a trace as a Graphviz digraph, one node per
 * block and one edge per successor address.
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class FlowGraphExporter {

    private static final Logger logger = LoggerFactory.getLogger(FlowGraphExporter.class);

    public static final String GRAPH_NAME = "Code Execution Graph";

    public static String blockName(CodeBlock block) {
        return PrintUtils.toHex(block.getStart()) + "-" + PrintUtils.toHex(block.getEnd());
    }

    /**
     * Terminal markers are reported, not drawn. Successors that start no
     * block are reported as missing and skipped.
     */
    public MutableGraph toGraph(TraceResult result) {
        final MutableGraph graph = mutGraph(GRAPH_NAME).setDirected(true);
        final Map<Long, MutableNode> nodes = new HashMap<Long, MutableNode>();
        for(CodeBlock block : result.getBlocks()) {
            final MutableNode node = mutNode(blockName(block));
            graph.add(node);
            nodes.put(block.getStart(), node);
        }

        for(CodeBlock block : result.getBlocks()) {
            final MutableNode from = nodes.get(block.getStart());
            for(Successor successor : block.getSuccessors()) {
                if(successor.isTerminal()) {
                    logger.info("{}: {}", blockName(block), successor.getDiagnostic());
                    continue;
                }
                final MutableNode to = nodes.get(successor.getAddress());
                if(to == null) {
                    logger.warn("Missing code block: {}", PrintUtils.toHex(successor.getAddress()));
                    continue;
                }
                from.addLink(to);
            }
        }
        return graph;
    }

    public String toDot(TraceResult result) {
        return toGraph(result).toString();
    }

    public void writeTo(TraceResult result, String fileName) throws IOException {
        Files.write(new File(fileName).toPath(), toDot(result).getBytes(StandardCharsets.UTF_8));
    }
}
