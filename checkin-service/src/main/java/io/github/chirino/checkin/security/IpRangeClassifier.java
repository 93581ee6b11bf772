package io.github.chirino.checkin.security;

import com.maxmind.db.CHMCache;
import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.CountryResponse;
import java.io.File;
import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Maps a caller-supplied IP address to a coarse region code.
 *
 * <p>Private and loopback addresses are always {@link #LOCAL}. When a GeoIP2 country database is
 * configured it is opened lazily on the first lookup; otherwise, or when the database has no
 * answer, the static {@link RegionRangeTable} is consulted. Malformed input yields {@link
 * #UNKNOWN}.
 */
public class IpRangeClassifier {

    private static final Logger LOG = Logger.getLogger(IpRangeClassifier.class);

    public static final String LOCAL = "local";
    public static final String UNKNOWN = "unknown";

    private final RegionRangeTable fallback;
    private final Optional<Path> geoDatabase;
    private final Object readerLock = new Object();
    private volatile DatabaseReader reader;
    private volatile boolean readerFailed;

    public IpRangeClassifier(RegionRangeTable fallback, Optional<Path> geoDatabase) {
        this.fallback = fallback;
        this.geoDatabase = geoDatabase == null ? Optional.empty() : geoDatabase;
    }

    public String classify(String ip) {
        Optional<InetAddress> parsed = IpAddresses.parseLiteral(ip);
        if (parsed.isEmpty()) {
            return UNKNOWN;
        }
        InetAddress address = parsed.get();
        if (IpAddresses.isLocal(address)) {
            return LOCAL;
        }
        Optional<String> country = lookupCountry(address);
        if (country.isPresent()) {
            return country.get();
        }
        if (address instanceof Inet4Address v4 && fallback.contains(IpAddresses.toLong(v4))) {
            return fallback.region();
        }
        return UNKNOWN;
    }

    public boolean isLocal(String ip) {
        return LOCAL.equals(classify(ip));
    }

    private Optional<String> lookupCountry(InetAddress address) {
        DatabaseReader db = reader();
        if (db == null) {
            return Optional.empty();
        }
        try {
            return db.tryCountry(address)
                    .map(CountryResponse::getCountry)
                    .map(c -> c.getIsoCode())
                    .map(code -> code.toUpperCase(Locale.ROOT));
        } catch (IOException | GeoIp2Exception e) {
            LOG.debugf("GeoIP lookup failed for %s: %s", address.getHostAddress(), e.getMessage());
            return Optional.empty();
        }
    }

    private DatabaseReader reader() {
        if (geoDatabase.isEmpty() || readerFailed) {
            return null;
        }
        DatabaseReader current = reader;
        if (current != null) {
            return current;
        }
        synchronized (readerLock) {
            if (reader == null && !readerFailed) {
                File file = geoDatabase.get().toFile();
                try {
                    reader = new DatabaseReader.Builder(file).withCache(new CHMCache()).build();
                    LOG.infof("Loaded GeoIP database %s", file);
                } catch (IOException e) {
                    readerFailed = true;
                    LOG.warnf(
                            "GeoIP database %s could not be opened, using static range table:"
                                    + " %s",
                            file,
                            e.getMessage());
                }
            }
            return reader;
        }
    }
}
