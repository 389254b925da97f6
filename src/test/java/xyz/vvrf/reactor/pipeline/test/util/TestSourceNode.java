package xyz.vvrf.reactor.pipeline.test.util;

import xyz.vvrf.reactor.pipeline.core.DatatypeHierarchy;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.Output;

import java.util.Arrays;

/**
 * 只有一个输出端口 "out" 的测试节点。
 */
public class TestSourceNode extends Node {

    private final Output out;

    public TestSourceNode() {
        this(Output.DEFAULT_DATATYPES.toArray(new DatatypeHierarchy[0]));
    }

    public TestSourceNode(DatatypeHierarchy... datatypes) {
        this.out = Output.builder(this, "out")
                .type(Output.Type.M_SENDER)
                .possibleDatatypes(Arrays.asList(datatypes))
                .build();
    }

    @Override
    public String getName() {
        return "TestSource";
    }

    public Output getOut() {
        return out;
    }
}
