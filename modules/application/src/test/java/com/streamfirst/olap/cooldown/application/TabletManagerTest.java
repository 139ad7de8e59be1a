package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.adapters.FileTabletMetaStore;
import com.streamfirst.olap.cooldown.adapters.InMemoryRemoteBackend;
import com.streamfirst.olap.cooldown.domain.CooldownConf;
import com.streamfirst.olap.cooldown.domain.Version;
import com.streamfirst.olap.cooldown.ports.StorageRegistryPort;
import com.streamfirst.olap.cooldown.ports.TabletMetaStorePort;
import com.streamfirst.olap.cooldown.ports.codec.MetaCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TabletManagerTest {

    @TempDir
    Path dir;

    @Test
    void duplicateTabletIsRejected() throws IOException {
        CooldownTestFixture fixture = CooldownTestFixture.withBackend(dir, new InMemoryRemoteBackend("r"));
        fixture.tabletManager.createTablet(1L, 11, 10001L);

        assertThatThrownBy(() -> fixture.tabletManager.createTablet(1L, 11, 10001L))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already exists");
    }

    @Test
    void tabletsSurviveARestart() throws IOException {
        StorageRegistryPort registry = CooldownTestFixture.registryWith(new InMemoryRemoteBackend("r"));
        Path localRoot = dir.resolve("local");
        TabletMetaStorePort store = new FileTabletMetaStore(dir.resolve("meta"), new MetaCodec());
        CooldownTestFixture before = new CooldownTestFixture(localRoot, registry, store, CooldownOptions.defaults(),
            new MutableClock(CooldownTestFixture.START));
        Tablet tablet = before.createTabletWithData(7L, 10001L, new byte[] {1, 2, 3});
        tablet.updateCooldownConf(2, 10001L);
        tablet.setStoragePolicyId(CooldownTestFixture.POLICY_ID);
        before.tabletManager.createTablet(8L, 11, 10001L);

        CooldownTestFixture after = new CooldownTestFixture(localRoot, registry,
            new FileTabletMetaStore(dir.resolve("meta"), new MetaCodec()), CooldownOptions.defaults(),
            new MutableClock(CooldownTestFixture.START));

        assertThat(after.tabletManager.loadTablets()).isEqualTo(2);
        assertThat(after.tabletManager.loadTablets()).isZero();
        Tablet reopened = after.tabletManager.getTablet(7L).orElseThrow();
        assertThat(reopened.meta()).isEqualTo(tablet.meta());
        assertThat(reopened.cooldownConf()).isEqualTo(new CooldownConf(2, 10001L));
        assertThat(reopened.getRowsetByVersion(Version.of(2, 2))).isPresent();
        assertThat(after.tabletManager.tablets()).hasSize(2);
        assertThat(after.tabletManager.getTablet(9L)).isEmpty();
    }
}
