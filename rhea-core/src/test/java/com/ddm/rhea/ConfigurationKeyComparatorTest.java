package com.ddm.rhea;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link ConfigurationKeyComparator} 类的单元测试。
 *
 * @author liyifei
 */
class ConfigurationKeyComparatorTest {

    private final ConfigurationKeyComparator comparator = ConfigurationKeyComparator.INSTANCE;

    @Test
    void testNumericSegmentsCompareByValue() {
        assertTrue(comparator.compare("2", "10") < 0);
        assertTrue(comparator.compare("a:10", "a:9") > 0);
        assertEquals(0, comparator.compare("007", "7"));
        assertTrue(comparator.compare("123456789012345678901234567890", "99") > 0);
    }

    @Test
    void testNumbersBeforeText() {
        assertTrue(comparator.compare("9", "a") < 0);
        assertTrue(comparator.compare("a", "9") > 0);
    }

    @Test
    void testTextIgnoresCase() {
        assertEquals(0, comparator.compare("Logging", "LOGGING"));
        assertTrue(comparator.compare("alpha", "Beta") < 0);
    }

    @Test
    void testFewerSegmentsFirst() {
        assertTrue(comparator.compare("a", "a:b") < 0);
        assertTrue(comparator.compare("a:b:c", "a:b") > 0);
    }

    @Test
    void testEmptySegmentsIgnored() {
        assertEquals(0, comparator.compare(":Foo", "Foo"));
        assertEquals(0, comparator.compare("a::b", "a:b"));
    }

    @Test
    void testSort() {
        List<String> keys = new ArrayList<>(List.of("b", "10", "A", "2", "a:1", "1"));
        keys.sort(comparator);
        assertEquals(List.of("1", "2", "10", "A", "a:1", "b"), keys);
    }

    @Test
    void testIsIndex() {
        assertTrue(ConfigurationKeyComparator.isIndex("0"));
        assertTrue(ConfigurationKeyComparator.isIndex("0012"));
        assertFalse(ConfigurationKeyComparator.isIndex(""));
        assertFalse(ConfigurationKeyComparator.isIndex("-1"));
        assertFalse(ConfigurationKeyComparator.isIndex("1a"));
    }
}
