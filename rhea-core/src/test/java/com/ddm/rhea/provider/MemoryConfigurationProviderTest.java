package com.ddm.rhea.provider;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link MemoryConfigurationProvider} 类的单元测试。
 *
 * @author liyifei
 */
class MemoryConfigurationProviderTest {

    @Test
    void testGetIgnoresCase() {
        MemoryConfigurationProvider provider = new MemoryConfigurationProvider(Map.of("Server:Port", "8080"));
        assertNull(provider.get("server:port"));

        provider.load();

        assertEquals("8080", provider.get("server:port"));
        assertEquals("8080", provider.get("SERVER:PORT"));
        assertNull(provider.get("Server"));
    }

    @Test
    void testNullValuesAreSkipped() {
        Map<String, String> data = new HashMap<>();
        data.put("Present", "yes");
        data.put("Absent", null);
        MemoryConfigurationProvider provider = new MemoryConfigurationProvider(data);
        provider.load();

        assertEquals("yes", provider.get("Present"));
        assertNull(provider.get("Absent"));
    }

    @Test
    void testCollectChildKeys() {
        MemoryConfigurationProvider provider = new MemoryConfigurationProvider(
                Map.of("A:1", "x", "A:0", "y", "B", "z"));
        provider.load();

        List<String> top = new ArrayList<>();
        provider.collectChildKeys(top, null);
        assertEquals(List.of("A", "A", "B"), top);

        List<String> children = new ArrayList<>();
        provider.collectChildKeys(children, "a");
        assertEquals(List.of("0", "1"), children);
    }

    @Test
    void testReloadIsRepeatable() {
        MemoryConfigurationProvider provider = new MemoryConfigurationProvider(Map.of("Key", "value"));
        provider.load();
        provider.load();
        assertEquals("value", provider.get("key"));
        assertEquals("MemoryConfigurationProvider", provider.getName());
        assertFalse(provider.getReloadToken().isActive());
    }
}
