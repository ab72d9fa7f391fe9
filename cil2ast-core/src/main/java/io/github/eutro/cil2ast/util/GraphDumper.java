package io.github.eutro.cil2ast.util;

import io.github.eutro.cil2ast.ast.AstPrinter;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.ControlFlowEdge;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.ProtectedRegion;

/**
 * Renders control flow graphs in Graphviz dot syntax, for debugging.
 */
public class GraphDumper {
    /**
     * Whether the decompiler should log the graph of every method before structuring it.
     */
    public static boolean DUMP_GRAPHS = System.getenv("CIL2AST_DUMP_GRAPHS") != null;

    /**
     * Render a graph as a dot digraph.
     *
     * @param graph The graph.
     * @return The dot source.
     */
    public static String toDot(ControlFlowGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(AstPrinter.quote(graph.getMethodId().toString())).append(" {\n");
        sb.append("  node [shape=box, fontname=monospace];\n");
        for (BasicBlock block : graph.blocks) {
            StringBuilder label = new StringBuilder(block.getLabel()).append(":\\l");
            for (Statement stmt : block.getStatements()) {
                appendLines(label, AstPrinter.print(stmt));
            }
            appendLines(label, block.getControl().toString());
            sb.append("  ").append(id(block)).append(" [label=\"").append(label).append("\"");
            if (block == graph.getEntry()) sb.append(", penwidth=2");
            sb.append("];\n");
        }
        for (ControlFlowEdge edge : graph.getEdges()) {
            sb.append("  ").append(id(edge.getSource())).append(" -> ").append(id(edge.getTarget()));
            switch (edge.getKind()) {
                case BRANCH:
                    sb.append(" [color=darkgreen]");
                    break;
                case EXCEPTION_HANDLER:
                    sb.append(" [style=dashed, color=red]");
                    break;
                default:
                    break;
            }
            sb.append(";\n");
        }
        int i = 0;
        for (ProtectedRegion region : graph.getRegions()) {
            sb.append("  subgraph cluster_").append(i++).append(" {\n");
            sb.append("    label=").append(AstPrinter.quote(region.getKind().toString())).append(";\n");
            for (BasicBlock block : region.getTryBlocks()) {
                sb.append("    ").append(id(block)).append(";\n");
            }
            sb.append("  }\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String id(BasicBlock block) {
        return AstPrinter.quote(block.getLabel());
    }

    private static void appendLines(StringBuilder sb, String text) {
        for (String line : text.split("\n")) {
            sb.append(line.replace("\\", "\\\\").replace("\"", "\\\"")).append("\\l");
        }
    }
}
