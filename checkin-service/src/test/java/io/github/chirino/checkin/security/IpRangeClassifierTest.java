package io.github.chirino.checkin.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IpRangeClassifierTest {

    private final IpRangeClassifier classifier =
            new IpRangeClassifier(RegionRangeTable.defaultTable(), Optional.empty());

    @Test
    void private_and_loopback_addresses_are_local() {
        for (String ip :
                new String[] {
                    "127.0.0.1", "10.1.2.3", "172.16.0.9", "192.168.1.1", "169.254.3.3",
                    "0.0.0.0", "::1", "fd12:3456::1", "fe80::1"
                }) {
            assertEquals(IpRangeClassifier.LOCAL, classifier.classify(ip), ip);
            assertTrue(classifier.isLocal(ip), ip);
        }
    }

    @Test
    void malformed_input_is_unknown() {
        for (String ip :
                new String[] {
                    null, "", "   ", "not-an-ip", "1.2.3", "1.2.3.4.5", "256.1.1.1", "1..2.3",
                    "example.com", "1.2.3.-4", "12345::zz"
                }) {
            assertEquals(IpRangeClassifier.UNKNOWN, classifier.classify(ip), String.valueOf(ip));
        }
    }

    @Test
    void addresses_in_the_fallback_table_get_its_region() {
        assertEquals("CN", classifier.classify("1.0.1.1"));
        assertEquals("CN", classifier.classify("36.110.1.1"));
        assertEquals("CN", classifier.classify("223.255.255.255"));
    }

    @Test
    void addresses_outside_the_table_are_unknown() {
        assertEquals(IpRangeClassifier.UNKNOWN, classifier.classify("8.8.8.8"));
        assertEquals(IpRangeClassifier.UNKNOWN, classifier.classify("1.0.4.0"));
        assertEquals(IpRangeClassifier.UNKNOWN, classifier.classify("2001:4860:4860::8888"));
        assertFalse(classifier.isLocal("8.8.8.8"));
    }

    @Test
    void unreadable_geo_database_falls_back_to_the_table(@TempDir Path dir) {
        IpRangeClassifier withMissingDb =
                new IpRangeClassifier(
                        RegionRangeTable.defaultTable(), Optional.of(dir.resolve("missing.mmdb")));

        assertEquals("CN", withMissingDb.classify("1.0.1.1"));
        assertEquals(IpRangeClassifier.UNKNOWN, withMissingDb.classify("8.8.8.8"));
    }

    @Test
    void range_table_merges_overlaps_and_searches_boundaries() {
        RegionRangeTable table =
                RegionRangeTable.builder("XX")
                        .range("20.0.0.10", "20.0.0.20")
                        .range("20.0.0.15", "20.0.0.30")
                        .range("20.0.0.31", "20.0.0.40")
                        .range("30.0.0.0", "30.0.0.0")
                        .build();

        assertEquals(2, table.size());
        assertEquals("XX", table.region());
        assertTrue(table.contains(IpAddresses.ipv4ToLong("20.0.0.10")));
        assertTrue(table.contains(IpAddresses.ipv4ToLong("20.0.0.40")));
        assertTrue(table.contains(IpAddresses.ipv4ToLong("30.0.0.0")));
        assertFalse(table.contains(IpAddresses.ipv4ToLong("20.0.0.9")));
        assertFalse(table.contains(IpAddresses.ipv4ToLong("20.0.0.41")));
        assertFalse(table.contains(IpAddresses.ipv4ToLong("30.0.0.1")));
        assertFalse(table.contains(-1));
    }

    @Test
    void range_table_rejects_inverted_ranges() {
        assertThrows(
                IllegalArgumentException.class,
                () -> RegionRangeTable.builder("XX").range("20.0.0.2", "20.0.0.1"));
        assertThrows(
                IllegalArgumentException.class,
                () -> RegionRangeTable.builder("XX").range("bogus", "20.0.0.1"));
    }

    @Test
    void ipv4_conversion_is_unsigned() {
        assertEquals(0xFFFFFFFFL, IpAddresses.ipv4ToLong("255.255.255.255"));
        assertEquals(0L, IpAddresses.ipv4ToLong("0.0.0.0"));
        assertEquals(-1L, IpAddresses.ipv4ToLong("1.2.3.1000"));
    }
}
