package xyz.vvrf.reactor.pipeline.core;

/**
 * 在连接上传递的消息基类。
 * 子类通过 {@link #getDatatype()} 声明自己在类型分类体系中的位置。
 * 消息一旦发送即被多个队列共享，实现应视为不可变。
 *
 * @author ruifeng.wen
 */
public abstract class Message {

    /**
     * @return 此消息的类型标签
     */
    public abstract DatatypeEnum getDatatype();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getDatatype() + "]";
    }
}
