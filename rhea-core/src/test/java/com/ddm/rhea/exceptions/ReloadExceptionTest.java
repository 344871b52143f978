package com.ddm.rhea.exceptions;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link ReloadException} 类的单元测试。
 */
class ReloadExceptionTest {

    @Test
    void testSingleFailureMessage() {
        LoadException error = new LoadException("broken");
        ReloadException e = ReloadException.of(List.of(new ReloadException.ProviderFailure("Json", error)));

        assertEquals("broken (Json)", e.getMessage());
        assertSame(error, e.getCause());
        assertEquals(0, e.getSuppressed().length);
    }

    @Test
    void testMultipleFailuresMessage() {
        FileLoadException missing = FileLoadException.notFound(Path.of("a.json"));
        LoadException other = new LoadException("other");
        ReloadException e = ReloadException.of(List.of(
                new ReloadException.ProviderFailure("First", missing),
                new ReloadException.ProviderFailure("Second", other)));

        String nl = System.lineSeparator();
        assertEquals("One or more load errors occurred:"
                + nl + "  [1]: " + missing.getMessage() + " (First)"
                + nl + "  [2]: other (Second)", e.getMessage());
        assertArrayEquals(new Throwable[]{other}, e.getSuppressed());
        assertEquals(ReloadException.Kind.PROVIDER, e.getKind());
    }

    @Test
    void testBorrowed() {
        ReloadException e = ReloadException.borrowed(3);
        assertEquals(ReloadException.Kind.BORROWED, e.getKind());
        assertEquals(3, e.getOutstandingReaders());
        assertTrue(e.getFailures().isEmpty());
        assertNull(e.getCause());
    }

    @Test
    void testEmptyFailuresRejected() {
        assertThrows(IllegalArgumentException.class, () -> ReloadException.of(List.of()));
    }

    @Test
    void testExceptionHierarchy() {
        assertInstanceOf(ConfigurationException.class, ReloadException.borrowed(0));
        assertInstanceOf(LoadException.class, FileLoadException.notFound(Path.of("x")));
        assertInstanceOf(ConfigurationException.class, BindingException.custom("x"));
        assertNull(BindingException.custom("x").getFieldName());
    }
}
