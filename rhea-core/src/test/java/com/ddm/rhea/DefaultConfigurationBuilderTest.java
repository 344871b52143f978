package com.ddm.rhea;

import com.ddm.rhea.exceptions.FileLoadException;
import com.ddm.rhea.exceptions.LoadException;
import com.ddm.rhea.exceptions.ReloadException;
import com.ddm.rhea.provider.MemoryConfigurationProvider;
import com.ddm.rhea.token.NeverChangeToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * {@link DefaultConfigurationBuilder} 类的单元测试。
 *
 * @author liyifei
 */
class DefaultConfigurationBuilderTest {

    @TempDir
    Path dir;

    @Test
    void testSourcesKeepOrderWithoutDedup() {
        ConfigurationSource source = builder -> mock(ConfigurationProvider.class);
        DefaultConfigurationBuilder builder = new DefaultConfigurationBuilder();
        builder.add(source).add(source);

        assertEquals(2, builder.getSources().size());
        assertThrows(UnsupportedOperationException.class, () -> builder.getSources().clear());
    }

    @Test
    void testSourcesSeeSharedProperties() {
        DefaultConfigurationBuilder builder = new DefaultConfigurationBuilder().property("app.name", "demo");
        ConfigurationRoot root = builder
                .add(b -> new MemoryConfigurationProvider(
                        Map.of("Name", (String) b.getProperties().get("app.name"))))
                .build();

        assertEquals("demo", root.get("Name"));
    }

    @Test
    void testBuildCollectsEveryFailure() {
        ConfigurationProvider good = provider("Good");
        ConfigurationProvider bad = provider("Bad");
        doThrow(new LoadException("broken")).when(bad).load();

        ReloadException e = assertThrows(ReloadException.class, () -> new DefaultConfigurationBuilder()
                .add(b -> bad)
                .add(b -> good)
                .addJsonFile(dir.resolve("missing.json"))
                .build());

        assertEquals(ReloadException.Kind.PROVIDER, e.getKind());
        assertEquals(2, e.getFailures().size());
        assertEquals("broken (Bad)", e.getFailures().get(0).toString());
        FileLoadException missing = assertInstanceOf(FileLoadException.class, e.getFailures().get(1).error());
        assertEquals(FileLoadException.Reason.NOT_FOUND, missing.getReason());
        assertSame(e.getFailures().get(0).error(), e.getCause());
        assertEquals(1, e.getSuppressed().length);
        verify(good).load();
        verify(good).close();
        verify(bad).close();
    }

    @Test
    void testSingleFailureMessage() {
        ConfigurationProvider bad = provider("Bad");
        doThrow(new LoadException("broken")).when(bad).load();

        ReloadException e = assertThrows(ReloadException.class,
                () -> new DefaultConfigurationBuilder().add(b -> bad).build());

        assertEquals("broken (Bad)", e.getMessage());
    }

    @Test
    void testSourceFailureClosesBuiltProviders() {
        ConfigurationProvider built = provider("Built");
        DefaultConfigurationBuilder builder = new DefaultConfigurationBuilder();
        builder.add(b -> built).add(b -> {
            throw new IllegalStateException("cannot build");
        });

        assertThrows(IllegalStateException.class, builder::build);
        verify(built).close();
        verify(built, never()).load();
    }

    @Test
    void testEmptyBuilder() {
        ConfigurationRoot root = new DefaultConfigurationBuilder().build();
        assertTrue(root.getChildren().isEmpty());
        assertNull(root.get("Anything"));
        assertFalse(root.getReloadToken().hasChanged());
    }

    @Test
    void testReloadTimeoutProperty() {
        assertNotNull(new DefaultConfigurationBuilder().property(DefaultConfigurationBuilder.RELOAD_TIMEOUT, "2s").build());
        assertNotNull(new DefaultConfigurationBuilder().property(DefaultConfigurationBuilder.RELOAD_TIMEOUT, Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> new DefaultConfigurationBuilder()
                .property(DefaultConfigurationBuilder.RELOAD_TIMEOUT, Duration.ofSeconds(-5)).build());
        assertThrows(IllegalArgumentException.class, () -> new DefaultConfigurationBuilder()
                .property(DefaultConfigurationBuilder.RELOAD_TIMEOUT, "soon").build());
    }

    private static ConfigurationProvider provider(String name) {
        ConfigurationProvider provider = mock(ConfigurationProvider.class);
        when(provider.getName()).thenReturn(name);
        when(provider.getReloadToken()).thenReturn(NeverChangeToken.INSTANCE);
        return provider;
    }
}
