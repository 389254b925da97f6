package xyz.vvrf.reactor.pipeline.util;

import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.pipeline.core.Message;
import xyz.vvrf.reactor.pipeline.core.MessageQueue;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link MessageQueue} 与 Reactor 之间的桥接工具。
 *
 * @author ruifeng.wen
 */
public final class MessageQueues {

    private MessageQueues() {}

    /**
     * 把队列暴露为 Flux。每次请求在 scheduler 上阻塞读取一条消息，
     * 队列关闭并取空（或读取线程被中断）时完成。
     *
     * @param queue     来源队列，通常来自 {@code Output.getQueue()}
     * @param scheduler 执行阻塞读取的调度器
     */
    public static Flux<Message> toFlux(MessageQueue queue, Scheduler scheduler) {
        Objects.requireNonNull(queue, "队列不能为空");
        Objects.requireNonNull(scheduler, "调度器不能为空");
        return Flux.<Message>generate(sink -> {
                    Optional<Message> next = queue.get();
                    if (next.isPresent()) {
                        sink.next(next.get());
                    } else {
                        sink.complete();
                    }
                })
                .subscribeOn(scheduler);
    }

    /**
     * 同 {@link #toFlux(MessageQueue, Scheduler)}，只保留指定类型的消息。
     */
    public static <T extends Message> Flux<T> toFlux(MessageQueue queue, Class<T> type, Scheduler scheduler) {
        Objects.requireNonNull(type, "消息类型不能为空");
        return toFlux(queue, scheduler).ofType(type);
    }
}
