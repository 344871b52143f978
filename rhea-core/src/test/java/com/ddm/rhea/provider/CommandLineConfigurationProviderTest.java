package com.ddm.rhea.provider;

import com.ddm.rhea.ConfigurationRoot;
import com.ddm.rhea.DefaultConfigurationBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link CommandLineConfigurationProvider} 类的单元测试。
 *
 * @author liyifei
 */
class CommandLineConfigurationProviderTest {

    private static CommandLineConfigurationProvider load(List<String> args, Map<String, String> mappings) {
        CommandLineConfigurationProvider provider = (CommandLineConfigurationProvider)
                new CommandLineConfigurationSource(args, mappings).build(new DefaultConfigurationBuilder());
        provider.load();
        return provider;
    }

    @Test
    void testSupportedForms() {
        CommandLineConfigurationProvider provider = load(List.of(
                "Key1=Value1",
                "--Key2=Value2",
                "/Key3=Value3",
                "--Key4", "Value4",
                "/Key5", "Value5"), Map.of());

        assertEquals("Value1", provider.get("Key1"));
        assertEquals("Value2", provider.get("Key2"));
        assertEquals("Value3", provider.get("Key3"));
        assertEquals("Value4", provider.get("Key4"));
        assertEquals("Value5", provider.get("Key5"));
        assertEquals("CommandLine", provider.getName());
    }

    @Test
    void testKeysArePascalCased() {
        CommandLineConfigurationProvider provider = load(List.of("--no-build", "true", "--logging:level=Debug"), Map.of());

        assertEquals("true", provider.get("NoBuild"));
        assertEquals("Debug", provider.get("Logging:Level"));
        List<String> keys = new ArrayList<>();
        provider.collectChildKeys(keys, null);
        assertEquals(List.of("Logging", "NoBuild"), keys);
    }

    @Test
    void testSwitchMappings() {
        CommandLineConfigurationProvider provider = load(
                List.of("-p", "8080", "-H=localhost", "--verbose=yes", "-x", "ignored"),
                Map.of("-p", "Server:Port", "-h", "Server:Host", "--VERBOSE", "Logging:Verbose", "invalid", "Nope"));

        assertEquals("8080", provider.get("Server:Port"));
        assertEquals("localhost", provider.get("Server:Host"));
        assertEquals("yes", provider.get("Logging:Verbose"));
        assertNull(provider.get("x"));
        assertNull(provider.get("ignored"));
        assertNull(provider.get("Nope"));
    }

    @Test
    void testUnmappedShortSwitchIsIgnored() {
        CommandLineConfigurationProvider provider = load(List.of("-k=v", "-k", "v2", "--Key=kept"), Map.of());
        assertNull(provider.get("k"));
        assertEquals("kept", provider.get("Key"));
    }

    @Test
    void testDanglingSwitchAndPlainArgsIgnored() {
        CommandLineConfigurationProvider provider = load(List.of("plain", "--Last"), Map.of());
        assertNull(provider.get("plain"));
        assertNull(provider.get("Last"));
    }

    @Test
    void testLaterArgumentWins() {
        ConfigurationRoot root = new DefaultConfigurationBuilder()
                .addCommandLine(new String[]{"--Mode=a", "--mode=b"})
                .build();
        assertEquals("b", root.get("Mode"));
    }
}
