package com.ddm.rhea.provider;

import com.ddm.rhea.ConfigurationRoot;
import com.ddm.rhea.DefaultConfigurationBuilder;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link EnvironmentVariablesConfigurationProvider} 类的单元测试。
 *
 * @author liyifei
 */
class EnvironmentVariablesConfigurationProviderTest {

    private static final Map<String, String> ENV = Map.of(
            "APP_Logging__Level", "Debug",
            "app_Name", "demo",
            "APP_", "ignored",
            "PATH", "/usr/bin",
            "OTHER_Name", "other");

    @Test
    void testPrefixIsStrippedAndNestingApplied() {
        EnvironmentVariablesConfigurationProvider provider = new EnvironmentVariablesConfigurationProvider("APP_", () -> ENV);
        provider.load();

        assertEquals("Debug", provider.get("Logging:Level"));
        assertEquals("demo", provider.get("Name"));
        assertNull(provider.get("PATH"));
        assertNull(provider.get(""));
        assertEquals("EnvironmentVariables(APP_)", provider.getName());
    }

    @Test
    void testEmptyPrefixLoadsEverything() {
        EnvironmentVariablesConfigurationProvider provider = new EnvironmentVariablesConfigurationProvider("", () -> ENV);
        provider.load();

        assertEquals("/usr/bin", provider.get("path"));
        assertEquals("Debug", provider.get("APP_Logging:Level"));
        assertEquals("EnvironmentVariables", provider.getName());
    }

    @Test
    void testSourceThroughBuilder() {
        ConfigurationRoot root = new DefaultConfigurationBuilder()
                .add(new EnvironmentVariablesConfigurationSource(null, () -> ENV))
                .add(new EnvironmentVariablesConfigurationSource("OTHER_", () -> ENV))
                .build();

        assertEquals("other", root.get("Name"));
    }

    @Test
    void testProcessEnvironment() {
        ConfigurationRoot root = new DefaultConfigurationBuilder().addEnvironmentVariables().build();
        System.getenv().forEach((name, value) -> {
            if (!name.contains("__") && !name.isEmpty()) {
                assertNotNull(root.get(name), name);
            }
        });
    }
}
