package io.github.chirino.checkin.security;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable table of disjoint, inclusive IPv4 ranges for a single region. Lookups are a binary
 * search over the range starts.
 */
public final class RegionRangeTable {

    private final String region;
    private final long[] starts;
    private final long[] ends;

    private RegionRangeTable(String region, long[] starts, long[] ends) {
        this.region = region;
        this.starts = starts;
        this.ends = ends;
    }

    public String region() {
        return region;
    }

    public int size() {
        return starts.length;
    }

    public boolean contains(long ipv4) {
        if (ipv4 < 0 || starts.length == 0) {
            return false;
        }
        int idx = Arrays.binarySearch(starts, ipv4);
        if (idx >= 0) {
            return true;
        }
        // insertion point - 1 is the last range starting below the address
        int candidate = -idx - 2;
        return candidate >= 0 && ipv4 <= ends[candidate];
    }

    public static Builder builder(String region) {
        return new Builder(region);
    }

    /** Fallback ranges used when no geo database is configured. */
    public static RegionRangeTable defaultTable() {
        Builder builder =
                builder("CN")
                        .range("1.0.1.0", "1.0.3.255")
                        .range("1.0.8.0", "1.0.15.255")
                        .range("1.0.32.0", "1.0.63.255")
                        .range("1.1.0.0", "1.1.0.255")
                        .range("1.1.2.0", "1.1.63.255")
                        .range("1.2.0.0", "1.2.255.255")
                        .range("1.4.1.0", "1.4.127.255")
                        .range("1.8.0.0", "1.8.255.255")
                        .range("1.12.0.0", "1.15.255.255")
                        .range("1.24.0.0", "1.31.255.255")
                        .range("1.45.0.0", "1.45.255.255")
                        .range("1.48.0.0", "1.51.255.255")
                        .range("1.56.0.0", "1.63.255.255")
                        .range("1.68.0.0", "1.71.255.255")
                        .range("1.80.0.0", "1.95.255.255")
                        .range("1.116.0.0", "1.119.255.255")
                        .range("1.180.0.0", "1.183.255.255")
                        .range("1.188.0.0", "1.191.255.255")
                        .range("1.192.0.0", "1.207.255.255");
        int[] slashEights = {
            14, 27, 36, 39, 42, 49, 58, 59, 60, 61, 101, 103, 106, 139, 140, 144, 150, 153, 157,
            159, 163, 171, 175, 180, 182, 183, 202, 203, 210, 211
        };
        for (int octet : slashEights) {
            builder.slashEight(octet);
        }
        for (int octet = 110; octet <= 126; octet++) {
            builder.slashEight(octet);
        }
        for (int octet = 218; octet <= 223; octet++) {
            builder.slashEight(octet);
        }
        return builder.build();
    }

    public static final class Builder {
        private final String region;
        private final List<long[]> ranges = new ArrayList<>();

        private Builder(String region) {
            this.region = region;
        }

        public Builder range(String start, String end) {
            return range(IpAddresses.ipv4ToLong(start), IpAddresses.ipv4ToLong(end));
        }

        public Builder range(long start, long end) {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid range: " + start + "-" + end);
            }
            ranges.add(new long[] {start, end});
            return this;
        }

        Builder slashEight(int firstOctet) {
            long start = ((long) firstOctet) << 24;
            return range(start, start + 0xFFFFFFL);
        }

        /** Sorts the ranges and merges overlapping or adjacent ones. */
        public RegionRangeTable build() {
            List<long[]> sorted = new ArrayList<>(ranges);
            sorted.sort(Comparator.comparingLong(r -> r[0]));
            List<long[]> merged = new ArrayList<>();
            for (long[] r : sorted) {
                if (!merged.isEmpty()) {
                    long[] last = merged.get(merged.size() - 1);
                    if (r[0] <= last[1] + 1) {
                        last[1] = Math.max(last[1], r[1]);
                        continue;
                    }
                }
                merged.add(new long[] {r[0], r[1]});
            }
            long[] starts = new long[merged.size()];
            long[] ends = new long[merged.size()];
            for (int i = 0; i < merged.size(); i++) {
                starts[i] = merged.get(i)[0];
                ends[i] = merged.get(i)[1];
            }
            return new RegionRangeTable(region, starts, ends);
        }
    }
}
