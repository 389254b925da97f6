package xyz.vvrf.reactor.pipeline.util;

import xyz.vvrf.reactor.pipeline.core.Connection;
import xyz.vvrf.reactor.pipeline.core.LinkDescriptor;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.NodeDescriptor;
import xyz.vvrf.reactor.pipeline.core.Pipeline;
import xyz.vvrf.reactor.pipeline.core.PipelineDescriptor;

/**
 * 管道图的文本和 DOT 渲染工具。
 *
 * @author ruifeng.wen
 */
public final class PipelineGraphUtils {

    private PipelineGraphUtils() {}

    /**
     * 以表格形式渲染管道描述的节点和连接。
     */
    public static String formatStructure(PipelineDescriptor descriptor) {
        StringBuilder builder = new StringBuilder("\n节点:\n");
        builder.append(String.format("%-30s | %s\n", "别名", "类型 ID"));
        for (NodeDescriptor node : descriptor.getNodes()) {
            builder.append(String.format("%-30s | %s\n", node.getAlias(), node.getNodeTypeId()));
        }
        builder.append("\n连接:\n");
        builder.append(String.format("%-30s [%-20s] ---> %-30s [%-20s]\n", "输出节点", "输出端口", "输入节点", "输入端口"));
        for (LinkDescriptor link : descriptor.getLinks()) {
            builder.append(String.format("%-30s [%-20s] ---> %-30s [%-20s]\n",
                    link.getOutputAlias(), link.getOutputKey(), link.getInputAlias(), link.getInputKey()));
        }
        return builder.toString();
    }

    /**
     * 生成管道描述的 DOT 图形描述代码。
     */
    public static String toDot(PipelineDescriptor descriptor) {
        StringBuilder dot = new StringBuilder();
        String safeName = escapeDotString(descriptor.getName());

        dot.append(String.format("digraph \"%s\" {\n", safeName));
        dot.append("  rankdir=LR;\n");
        dot.append(String.format("  label=\"%s\";\n", safeName));
        dot.append("  node [shape=box, style=rounded];\n");

        for (NodeDescriptor node : descriptor.getNodes()) {
            String alias = escapeDotString(node.getAlias());
            String label = String.format("%s\\n(%s)", alias, escapeDotString(node.getNodeTypeId()));
            dot.append(String.format("  \"%s\" [label=\"%s\"];\n", alias, label));
        }
        for (LinkDescriptor link : descriptor.getLinks()) {
            dot.append(String.format("  \"%s\" -> \"%s\" [label=\"%s -> %s\"];\n",
                    escapeDotString(link.getOutputAlias()), escapeDotString(link.getInputAlias()),
                    escapeDotString(link.getOutputKey().toString()), escapeDotString(link.getInputKey().toString())));
        }
        dot.append("}\n");
        return dot.toString();
    }

    /**
     * 生成运行中管道的 DOT 图形描述代码，节点以 ID 标识，子管道渲染为 cluster。
     */
    public static String toDot(Pipeline pipeline) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"Pipeline\" {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box, style=rounded];\n");
        for (Node child : pipeline.getChildren()) {
            appendNode(dot, child, "  ");
        }
        for (Connection connection : pipeline.getAllConnections()) {
            dot.append(String.format("  \"%d\" -> \"%d\" [label=\"%s -> %s\"];\n",
                    connection.getOutputNodeId(), connection.getInputNodeId(),
                    escapeDotString(connection.getOutputKey().toString()),
                    escapeDotString(connection.getInputKey().toString())));
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static void appendNode(StringBuilder dot, Node node, String indent) {
        String label = escapeDotString(node.toString());
        if (node.getChildren().isEmpty()) {
            dot.append(String.format("%s\"%d\" [label=\"%s\"];\n", indent, node.getId(), label));
            return;
        }
        dot.append(String.format("%ssubgraph \"cluster_%d\" {\n", indent, node.getId()));
        dot.append(String.format("%s  label=\"%s\";\n", indent, label));
        dot.append(String.format("%s  \"%d\" [label=\"%s\", shape=ellipse];\n", indent, node.getId(), label));
        for (Node child : node.getChildren()) {
            appendNode(dot, child, indent + "  ");
        }
        dot.append(String.format("%s}\n", indent));
    }

    public static String escapeDotString(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
