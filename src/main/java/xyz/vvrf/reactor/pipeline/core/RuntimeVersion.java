package xyz.vvrf.reactor.pipeline.core;

import java.util.Objects;

/**
 * 节点所需的运行时版本（不可变数据类），格式为 "major.minor"。
 *
 * @author ruifeng.wen
 */
public final class RuntimeVersion implements Comparable<RuntimeVersion> {

    private final int major;
    private final int minor;

    public RuntimeVersion(int major, int minor) {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("版本号不能为负数: " + major + "." + minor);
        }
        this.major = major;
        this.minor = minor;
    }

    /**
     * 解析 "major.minor" 格式的版本字符串。
     *
     * @param version 版本字符串，如 "2022.1"
     * @return 版本对象
     * @throws IllegalArgumentException 如果格式不正确
     */
    public static RuntimeVersion parse(String version) {
        Objects.requireNonNull(version, "版本字符串不能为空");
        String[] parts = version.trim().split("\\.");
        if (parts.length != 2) {
            throw new IllegalArgumentException("版本字符串格式应为 'major.minor': " + version);
        }
        try {
            return new RuntimeVersion(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("版本字符串包含非数字部分: " + version, e);
        }
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    @Override
    public int compareTo(RuntimeVersion other) {
        int byMajor = Integer.compare(major, other.major);
        return byMajor != 0 ? byMajor : Integer.compare(minor, other.minor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RuntimeVersion that = (RuntimeVersion) o;
        return major == that.major && minor == that.minor;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
