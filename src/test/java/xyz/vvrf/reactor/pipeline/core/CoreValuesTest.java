package xyz.vvrf.reactor.pipeline.core;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoreValuesTest {

    @Test
    void portKey_shouldRenderGroupAndName() {
        assertThat(PortKey.of("out").toString()).isEqualTo("out");
        assertThat(PortKey.of("streams", "left").toString()).isEqualTo("streams:left");
        assertThat(PortKey.of(null, "out")).isEqualTo(PortKey.of("out"));
        assertThat(PortKey.of("streams", "left").hasGroup()).isTrue();
        assertThat(PortKey.of("a").compareTo(PortKey.of("g", "a"))).isNegative();
        assertThatThrownBy(() -> PortKey.of("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void connection_shouldUseStructuralEquality() {
        Connection a = new Connection(1, PortKey.of("out"), 2, PortKey.of("in"));
        Connection b = new Connection(1, PortKey.of("out"), 2, PortKey.of("in"));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new Connection(1, PortKey.of("out"), 3, PortKey.of("in")));
        assertThat(a.touches(2)).isTrue();
        assertThat(a.touches(3)).isFalse();
        assertThat(a.toString()).isEqualTo("Connection[1.out -> 2.in]");
    }

    @Test
    void runtimeVersion_shouldParseAndCompare() {
        RuntimeVersion version = RuntimeVersion.parse("2.10");

        assertThat(version.getMajor()).isEqualTo(2);
        assertThat(version.getMinor()).isEqualTo(10);
        assertThat(version).isGreaterThan(new RuntimeVersion(2, 9));
        assertThat(version.toString()).isEqualTo("2.10");
        assertThatThrownBy(() -> RuntimeVersion.parse("two")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void assetManager_shouldCopyOnSetAndExposeReadOnlyViews() {
        AssetManager assets = new AssetManager();
        byte[] data = {1, 2, 3};
        assets.set("blob", data);
        data[0] = 9;

        ByteBuffer stored = assets.get("blob").get();

        assertThat(stored.get(0)).isEqualTo((byte) 1);
        assertThat(stored.isReadOnly()).isTrue();
        assertThat(assets.has("blob")).isTrue();
        assertThat(assets.getKeys()).containsExactly("blob");
        assertThat(assets.remove("blob")).isTrue();
        assertThat(assets.size()).isZero();
        assertThat(assets.get("blob")).isEmpty();
    }
}
