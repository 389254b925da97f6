package xyz.vvrf.reactor.pipeline.core;

import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 按键保存二进制资源的容器，供节点通过 "asset:" URI 加载。
 * 线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class AssetManager {

    public static final String ASSET_SCHEME = "asset:";

    private final ConcurrentMap<String, byte[]> assets = new ConcurrentHashMap<>();

    /**
     * 保存（或替换）一个资源。数据会被复制。
     *
     * @param key  资源键 (不能为空)
     * @param data 资源内容 (不能为空)
     */
    public void set(String key, byte[] data) {
        Objects.requireNonNull(key, "资源键不能为空");
        Objects.requireNonNull(data, "资源内容不能为空");
        byte[] previous = assets.put(key, Arrays.copyOf(data, data.length));
        if (previous != null) {
            log.debug("资源 '{}' 已被替换 ({} -> {} 字节)", key, previous.length, data.length);
        }
    }

    /**
     * @return 资源的只读视图；不存在时为空
     */
    public Optional<ByteBuffer> get(String key) {
        Objects.requireNonNull(key, "资源键不能为空");
        byte[] data = assets.get(key);
        return data == null ? Optional.empty() : Optional.of(ByteBuffer.wrap(data).asReadOnlyBuffer());
    }

    public boolean has(String key) {
        return key != null && assets.containsKey(key);
    }

    public boolean remove(String key) {
        return key != null && assets.remove(key) != null;
    }

    /**
     * @return 所有资源键（有序快照）
     */
    public Set<String> getKeys() {
        return Collections.unmodifiableSet(new TreeSet<>(assets.keySet()));
    }

    public int size() {
        return assets.size();
    }
}
