package com.ddm.rhea.provider;

import com.ddm.rhea.ConfigurationRoot;
import com.ddm.rhea.ConfigurationSection;
import com.ddm.rhea.DefaultConfigurationBuilder;
import com.ddm.rhea.token.ChangeToken;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link ChainedConfigurationProvider} 类的单元测试。
 *
 * @author liyifei
 */
class ChainedConfigurationProviderTest {

    @Test
    void testDelegatesToWrappedConfiguration() {
        ConfigurationRoot inner = new DefaultConfigurationBuilder()
                .addInMemory(Map.of("Db:Name", "inner", "Db:Hosts:0", "h0"))
                .build();
        ConfigurationRoot outer = new DefaultConfigurationBuilder()
                .addConfiguration(inner)
                .addInMemory(Map.of("Db:Port", "5432"))
                .build();

        assertEquals("inner", outer.get("db:name"));
        assertEquals("5432", outer.get("Db:Port"));
        assertEquals(List.of("Hosts", "Name", "Port"),
                outer.getSection("Db").getChildren().stream().map(ConfigurationSection::getKey).toList());
        assertEquals("Chained", outer.getProviders().get(0).getName());
    }

    @Test
    void testWrapsSection() {
        ConfigurationRoot inner = new DefaultConfigurationBuilder()
                .addInMemory(Map.of("Db:Name", "inner"))
                .build();
        ConfigurationRoot outer = new DefaultConfigurationBuilder()
                .addConfiguration(inner.getSection("Db"))
                .build();

        assertEquals("inner", outer.get("Name"));
        assertEquals(1, outer.getChildren().size());
    }

    @Test
    void testReloadOfInnerFiresOuterToken() {
        ConfigurationRoot inner = new DefaultConfigurationBuilder().addInMemory(Map.of("A", "1")).build();
        ConfigurationRoot outer = new DefaultConfigurationBuilder().addConfiguration(inner).build();
        ChangeToken token = outer.getReloadToken();
        AtomicInteger fired = new AtomicInteger();
        token.registerChangeCallback(fired::incrementAndGet);

        inner.reload();

        assertEquals(1, fired.get());
        ChangeToken next = outer.getReloadToken();
        assertNotSame(token, next);
        assertFalse(next.hasChanged());

        inner.reload();
        assertEquals(1, fired.get());
        assertTrue(next.hasChanged());
    }
}
