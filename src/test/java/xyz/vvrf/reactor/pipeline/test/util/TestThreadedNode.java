package xyz.vvrf.reactor.pipeline.test.util;

import xyz.vvrf.reactor.pipeline.core.Input;
import xyz.vvrf.reactor.pipeline.core.Message;
import xyz.vvrf.reactor.pipeline.core.Output;
import xyz.vvrf.reactor.pipeline.core.ThreadedNode;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 可配置执行逻辑的测试执行节点，带一个输入 "in" 和一个输出 "out"。
 */
public class TestThreadedNode extends ThreadedNode {

    /**
     * 节点执行逻辑。
     */
    public interface RunLogic {
        void run(TestThreadedNode node) throws Exception;
    }

    private final Input in = Input.builder(this, "in").build();
    private final Output out = Output.builder(this, "out").build();
    private final RunLogic logic;
    private final CountDownLatch entered = new CountDownLatch(1);
    private final AtomicInteger startCalls = new AtomicInteger();
    private final AtomicInteger stopCalls = new AtomicInteger();
    private final AtomicInteger runCalls = new AtomicInteger();

    public TestThreadedNode(RunLogic logic) {
        this.logic = logic;
    }

    /**
     * 把 in 收到的每条消息原样转发到 out，直到输入队列关闭。
     */
    public static TestThreadedNode passthrough() {
        return new TestThreadedNode(node -> {
            while (node.isRunning()) {
                Optional<Message> message = node.getIn().get();
                if (!message.isPresent()) {
                    return;
                }
                node.getOut().send(message.get());
            }
        });
    }

    /**
     * 阻塞读取输入直到被停止。
     */
    public static TestThreadedNode blockingReader() {
        return new TestThreadedNode(node -> {
            while (node.isRunning() && node.getIn().get().isPresent()) {
                // 丢弃
            }
        });
    }

    @Override
    public String getName() {
        return "TestThreaded";
    }

    @Override
    protected void start() {
        startCalls.incrementAndGet();
    }

    @Override
    protected void stop() {
        stopCalls.incrementAndGet();
    }

    @Override
    protected void run() throws Exception {
        runCalls.incrementAndGet();
        entered.countDown();
        logic.run(this);
    }

    public Input getIn() {
        return in;
    }

    public Output getOut() {
        return out;
    }

    public CountDownLatch getEntered() {
        return entered;
    }

    public int getStartCalls() {
        return startCalls.get();
    }

    public int getStopCalls() {
        return stopCalls.get();
    }

    public int getRunCalls() {
        return runCalls.get();
    }
}
