package com.ddm.rhea.provider.file;

import com.ddm.rhea.ConfigurationRoot;
import com.ddm.rhea.DefaultConfigurationBuilder;
import com.ddm.rhea.token.ChangeToken;
import com.ddm.rhea.token.ChangeTokens;
import com.ddm.rhea.token.Registration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link FileConfigurationProvider} 类的单元测试：文件监听与重新加载。
 *
 * @author liyifei
 */
class FileConfigurationProviderTest {

    @TempDir
    Path dir;

    private static FileSource watched(Path file) {
        return FileSource.builder(file).reloadOnChange().reloadDelay(Duration.ofMillis(200)).build();
    }

    @Test
    void testReloadOnChange() throws Exception {
        Path file = dir.resolve("app.json");
        Files.writeString(file, "{\"Mode\":\"initial\"}");
        try (ConfigurationRoot root = new DefaultConfigurationBuilder().addJsonFile(watched(file)).build()) {
            ChangeToken token = root.getReloadToken();
            CountDownLatch latch = new CountDownLatch(1);
            token.registerChangeCallback(latch::countDown);

            Files.writeString(file, "{\"Mode\":\"updated\"}");

            assertTrue(latch.await(10, TimeUnit.SECONDS), "root token should fire after file change");
            assertEquals("updated", root.get("Mode"));
            assertNotSame(token, root.getReloadToken());
        }
    }

    @Test
    void testBurstOfWritesReloadsOnce() throws Exception {
        Path file = dir.resolve("burst.json");
        Files.writeString(file, "{\"Mode\":\"initial\"}");
        FileSource source = FileSource.builder(file).reloadOnChange().reloadDelay(Duration.ofSeconds(1)).build();
        try (JsonConfigurationProvider provider = new JsonConfigurationProvider(source)) {
            provider.load();
            AtomicInteger reloads = new AtomicInteger();
            CountDownLatch latch = new CountDownLatch(1);
            Registration counting = ChangeTokens.onChange(provider::getReloadToken, () -> {
                reloads.incrementAndGet();
                latch.countDown();
            });

            for (int i = 1; i <= 5; i++) {
                Files.writeString(file, "{\"Mode\":\"write-" + i + "\"}");
                Thread.sleep(50);
            }
            // 重新加载尚在等待中，读取不受影响
            long start = System.nanoTime();
            assertEquals("initial", provider.get("Mode"));
            assertTrue(System.nanoTime() - start < TimeUnit.MILLISECONDS.toNanos(100));

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            Thread.sleep(1500);

            assertEquals(1, reloads.get());
            assertEquals("write-5", provider.get("Mode"));
            counting.close();
        }
    }

    @Test
    void testMalformedChangeKeepsPreviousData() throws Exception {
        Path file = dir.resolve("app.ini");
        Files.writeString(file, "Mode=initial\n");
        try (IniConfigurationProvider provider = new IniConfigurationProvider(watched(file))) {
            provider.load();
            ChangeToken token = provider.getReloadToken();

            Files.writeString(file, "not an ini line\n");
            Thread.sleep(1000);

            assertEquals("initial", provider.get("Mode"));
            assertFalse(token.hasChanged());

            CountDownLatch latch = new CountDownLatch(1);
            token.registerChangeCallback(latch::countDown);
            Files.writeString(file, "Mode=fixed\n");
            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals("fixed", provider.get("Mode"));
        }
    }

    @Test
    void testDeletedFileBecomesEmpty() throws Exception {
        Path file = dir.resolve("app.json");
        Files.writeString(file, "{\"Mode\":\"initial\"}");
        try (JsonConfigurationProvider provider = new JsonConfigurationProvider(watched(file))) {
            provider.load();
            CountDownLatch latch = new CountDownLatch(1);
            provider.getReloadToken().registerChangeCallback(latch::countDown);

            Files.delete(file);

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertNull(provider.get("Mode"));
        }
    }

    @Test
    void testRootLoadDoesNotFireProviderToken() throws Exception {
        Path file = dir.resolve("app.json");
        Files.writeString(file, "{\"Mode\":\"initial\"}");
        JsonConfigurationProvider provider = new JsonConfigurationProvider(FileSource.of(file));
        ChangeToken token = provider.getReloadToken();

        provider.load();
        provider.load();

        assertFalse(token.hasChanged());
        assertSame(token, provider.getReloadToken());
    }

    @Test
    void testClosedProviderIgnoresChanges() throws Exception {
        Path file = dir.resolve("app.json");
        Files.writeString(file, "{\"Mode\":\"initial\"}");
        JsonConfigurationProvider provider = new JsonConfigurationProvider(watched(file));
        provider.load();
        AtomicInteger fired = new AtomicInteger();
        provider.getReloadToken().registerChangeCallback(fired::incrementAndGet);
        provider.close();

        Files.writeString(file, "{\"Mode\":\"updated\"}");
        Thread.sleep(500);

        assertEquals(0, fired.get());
        assertEquals("initial", provider.get("Mode"));
    }

    @Test
    void testFileSourceDefaults() {
        FileSource source = FileSource.of(dir.resolve("a.json"));
        assertFalse(source.optional());
        assertFalse(source.reloadOnChange());
        assertEquals(FileSource.DEFAULT_RELOAD_DELAY, source.reloadDelay());
        assertTrue(FileSource.builder(dir.resolve("a.json")).optional().build().optional());
    }
}
