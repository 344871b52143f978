package com.ddm.rhea.token;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link FileChangeToken} 类的单元测试。
 *
 * @author liyifei
 */
class FileChangeTokenTest {

    @TempDir
    Path dir;

    @Test
    void testFiresWhenFileIsModified() throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{}");
        FileChangeToken token = new FileChangeToken(file);
        CountDownLatch latch = new CountDownLatch(1);
        token.registerChangeCallback(latch::countDown);

        Files.writeString(file, "{\"a\":1}");

        assertTrue(latch.await(10, TimeUnit.SECONDS), "token should fire after modification");
        assertTrue(token.hasChanged());
    }

    @Test
    void testFiresWhenFileIsCreated() throws Exception {
        Path file = dir.resolve("later.ini");
        FileChangeToken token = new FileChangeToken(file);
        CountDownLatch latch = new CountDownLatch(1);
        token.registerChangeCallback(latch::countDown);

        Files.writeString(file, "a=1");

        assertTrue(latch.await(10, TimeUnit.SECONDS), "token should fire after creation");
    }

    @Test
    void testOtherFilesDoNotFire() throws Exception {
        Path file = dir.resolve("watched.json");
        Files.writeString(file, "{}");
        FileChangeToken token = new FileChangeToken(file);
        CountDownLatch latch = new CountDownLatch(1);
        token.registerChangeCallback(latch::countDown);

        Files.writeString(dir.resolve("other.json"), "{}");

        assertFalse(latch.await(500, TimeUnit.MILLISECONDS));
        assertFalse(token.hasChanged());
    }

    @Test
    void testPathIsAbsolute() {
        FileChangeToken token = new FileChangeToken(Path.of("relative", "..", "app.json"));
        assertTrue(token.getPath().isAbsolute());
        assertEquals("app.json", token.getPath().getFileName().toString());
    }
}
