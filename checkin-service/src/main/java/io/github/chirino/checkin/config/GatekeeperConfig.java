package io.github.chirino.checkin.config;

import jakarta.enterprise.context.ApplicationScoped;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class GatekeeperConfig {

    @ConfigProperty(name = "checkin.rate-limit.window", defaultValue = "PT60S")
    Duration rateLimitWindow;

    @ConfigProperty(name = "checkin.rate-limit.max-writes", defaultValue = "10")
    int rateLimitMaxWrites;

    @ConfigProperty(name = "checkin.rate-limit.ban-duration", defaultValue = "PT300S")
    Duration rateLimitBanDuration;

    @ConfigProperty(name = "checkin.duplicate.window", defaultValue = "PT300S")
    Duration duplicateWindow;

    @ConfigProperty(name = "checkin.honeypot.min-elapsed", defaultValue = "PT3S")
    Duration honeypotMinElapsed;

    @ConfigProperty(name = "checkin.honeypot.max-elapsed", defaultValue = "PT1H")
    Duration honeypotMaxElapsed;

    @ConfigProperty(name = "checkin.region.blocked", defaultValue = "CN")
    Set<String> blockedRegions;

    @ConfigProperty(name = "checkin.region.geoip-database")
    Optional<String> geoipDatabase;

    @ConfigProperty(name = "checkin.blocklist.file", defaultValue = "data/blacklist.txt")
    String blocklistFile;

    @ConfigProperty(
            name = "checkin.screening.keyword-file",
            defaultValue = "data/spam_keywords.txt")
    String keywordFile;

    @ConfigProperty(name = "checkin.screening.max-scan-length", defaultValue = "10000")
    int maxScanLength;

    @ConfigProperty(
            name = "checkin.screening.nickname-phrases",
            defaultValue = "wumao,五毛,小粉红")
    List<String> nicknamePhrases;

    public Duration getRateLimitWindow() {
        return rateLimitWindow;
    }

    public int getRateLimitMaxWrites() {
        return rateLimitMaxWrites;
    }

    public Duration getRateLimitBanDuration() {
        return rateLimitBanDuration;
    }

    public Duration getDuplicateWindow() {
        return duplicateWindow;
    }

    public Duration getHoneypotMinElapsed() {
        return honeypotMinElapsed;
    }

    public Duration getHoneypotMaxElapsed() {
        return honeypotMaxElapsed;
    }

    public Set<String> getBlockedRegions() {
        return blockedRegions;
    }

    public Optional<Path> getGeoipDatabase() {
        return geoipDatabase.filter(s -> !s.isBlank()).map(Path::of);
    }

    public Path getBlocklistFile() {
        return Path.of(blocklistFile);
    }

    public Path getKeywordFile() {
        return Path.of(keywordFile);
    }

    public int getMaxScanLength() {
        return maxScanLength;
    }

    public List<String> getNicknamePhrases() {
        return nicknamePhrases;
    }
}
