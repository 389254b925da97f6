package xyz.vvrf.reactor.pipeline.core;

/**
 * 消息类型分类体系。
 * 每个类型标签至多有一个父类型，{@link #BUFFER} 是所有消息的根类型。
 * 仅用于端口兼容性元数据，不对消息对象本身做运行时检查。
 *
 * @author ruifeng.wen
 */
public enum DatatypeEnum {
    BUFFER(null),
    IMG_FRAME(BUFFER),
    ENCODED_FRAME(BUFFER),
    NN_DATA(BUFFER),
    IMG_DETECTIONS(BUFFER),
    SPATIAL_IMG_DETECTIONS(IMG_DETECTIONS),
    IMAGE_MANIP_CONFIG(BUFFER),
    CAMERA_CONTROL(BUFFER),
    IMU_DATA(BUFFER),
    TRACKLETS(BUFFER),
    SYSTEM_INFORMATION(BUFFER),
    MESSAGE_GROUP(BUFFER);

    private final DatatypeEnum parent;

    DatatypeEnum(DatatypeEnum parent) {
        this.parent = parent;
    }

    /**
     * @return 直接父类型，根类型返回 null
     */
    public DatatypeEnum getParent() {
        return parent;
    }

    /**
     * 判断当前类型是否为给定类型的（严格）后代。
     *
     * @param ancestor 祖先类型
     * @return 沿父链能到达 ancestor 时为 true；类型自身不算后代
     */
    public boolean isDescendantOf(DatatypeEnum ancestor) {
        if (ancestor == null) {
            return false;
        }
        DatatypeEnum current = parent;
        while (current != null) {
            if (current == ancestor) {
                return true;
            }
            current = current.parent;
        }
        return false;
    }
}
