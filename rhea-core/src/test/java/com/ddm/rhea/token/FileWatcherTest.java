package com.ddm.rhea.token;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link FileWatcher} 类的单元测试。
 */
class FileWatcherTest {

    @TempDir
    Path dir;

    @Test
    void testClosingLastRegistrationReleasesDirectory() throws Exception {
        Path first = dir.resolve("a.json");
        Path second = dir.resolve("b.json");
        FileWatcher watcher = FileWatcher.shared();

        Registration a = watcher.watch(first, () -> {
        });
        Registration b = watcher.watch(second, () -> {
        });
        assertTrue(watcher.isWatching(first));
        assertTrue(watcher.isWatchingDirectory(dir));

        a.close();
        assertFalse(watcher.isWatching(first));
        assertTrue(watcher.isWatchingDirectory(dir));

        b.close();
        assertFalse(watcher.isWatching(second));
        assertFalse(watcher.isWatchingDirectory(dir));
    }

    @Test
    void testWatchingResumesAfterRelease() throws Exception {
        Path file = dir.resolve("c.ini");
        FileWatcher watcher = FileWatcher.shared();
        watcher.watch(file, () -> {
        }).close();
        assertFalse(watcher.isWatchingDirectory(dir));

        CountDownLatch latch = new CountDownLatch(1);
        Registration registration = watcher.watch(file, latch::countDown);
        Files.writeString(file, "a=1");

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        registration.close();
    }

    @Test
    void testMissingDirectoryIsNotWatched() {
        Path file = dir.resolve("missing").resolve("d.json");

        assertSame(Registration.NONE, FileWatcher.shared().watch(file, () -> {
        }));
        assertFalse(FileWatcher.shared().isWatching(file));
    }
}
