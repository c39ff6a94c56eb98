package com.telefonchi.database.migration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.CRC32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.StreamUtils;

/**
 * Discovers SQL migration units from Spring resource locations.
 *
 * <p>Each location is a directory such as {@code classpath:db/migration} or {@code
 * file:./migrations}. Every {@code *.sql} file directly inside it must be named {@code
 * <identifier>.up.sql} or {@code <identifier>.down.sql}, and every identifier needs both. A
 * {@code classpath:} location is searched across the whole classpath.
 */
public class MigrationScriptLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationScriptLoader.class);

    static final Pattern SCRIPT_NAME = Pattern.compile("(.+)\\.(up|down)\\.sql");

    private static final String UP = "up";

    private final ResourcePatternResolver resolver;

    public MigrationScriptLoader() {
        this(new PathMatchingResourcePatternResolver());
    }

    /** @param resolver resolves {@code classpath*:} and {@code file:} location patterns */
    public MigrationScriptLoader(ResourcePatternResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        this.resolver = resolver;
    }

    /**
     * Loads every unit found under the given locations.
     *
     * @return units sorted by identifier
     * @throws DiscoveryException on a malformed file name, a script without its counterpart, the
     *     same script found twice, or a script that cannot be read
     */
    public List<SqlMigrationUnit> load(List<String> locations) {
        Map<String, ScriptPair> pairs = new TreeMap<>();
        for (String location : locations) {
            for (Resource resource : resolve(location)) {
                register(pairs, resource);
            }
        }

        List<SqlMigrationUnit> units = new ArrayList<>(pairs.size());
        for (Map.Entry<String, ScriptPair> entry : pairs.entrySet()) {
            units.add(entry.getValue().toUnit(entry.getKey()));
        }
        units.sort(Comparator.comparing(SqlMigrationUnit::identifier));
        log.debug("Discovered {} SQL migration(s) in {}", units.size(), locations);
        return units;
    }

    private Resource[] resolve(String location) {
        String pattern = toPattern(location);
        try {
            return resolver.getResources(pattern);
        } catch (IOException e) {
            throw new DiscoveryException("Cannot list migration scripts at " + location, e);
        }
    }

    static String toPattern(String location) {
        if (location == null || location.isBlank()) {
            throw new DiscoveryException("Migration location must not be blank");
        }
        String base = location.strip();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (base.startsWith(ResourcePatternResolver.CLASSPATH_URL_PREFIX)
                && !base.startsWith(ResourcePatternResolver.CLASSPATH_ALL_URL_PREFIX)) {
            base =
                    ResourcePatternResolver.CLASSPATH_ALL_URL_PREFIX
                            + base.substring(ResourcePatternResolver.CLASSPATH_URL_PREFIX.length());
        }
        return base + "/*.sql";
    }

    private void register(Map<String, ScriptPair> pairs, Resource resource) {
        String filename = resource.getFilename();
        Matcher matcher = SCRIPT_NAME.matcher(filename == null ? "" : filename);
        if (!matcher.matches()) {
            throw new DiscoveryException(
                    ("Malformed migration script name '%s':"
                                    + " expected <identifier>.up.sql or <identifier>.down.sql")
                            .formatted(filename));
        }
        String identifier = MigrationIdentifiers.requireValid(matcher.group(1));
        ScriptPair pair = pairs.computeIfAbsent(identifier, id -> new ScriptPair());
        String script = read(resource);
        if (UP.equals(matcher.group(2))) {
            if (pair.up != null) {
                throw duplicate(filename, pair.upSource, resource);
            }
            pair.up = script;
            pair.upSource = resource;
        } else {
            if (pair.down != null) {
                throw duplicate(filename, pair.downSource, resource);
            }
            pair.down = script;
            pair.downSource = resource;
        }
    }

    private static DiscoveryException duplicate(String filename, Resource first, Resource second) {
        return new DiscoveryException(
                "Migration script '%s' found twice: %s and %s"
                        .formatted(filename, first.getDescription(), second.getDescription()));
    }

    private static String read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8)
                    .replace("\r\n", "\n")
                    .replace("\uFEFF", "");
        } catch (IOException e) {
            throw new DiscoveryException(
                    "Cannot read migration script " + resource.getDescription(), e);
        }
    }

    /** CRC32 over both normalized scripts, as eight lowercase hex digits. */
    static String checksum(String up, String down) {
        CRC32 crc = new CRC32();
        crc.update(up.getBytes(StandardCharsets.UTF_8));
        crc.update('\n');
        crc.update(down.getBytes(StandardCharsets.UTF_8));
        return String.format("%08x", crc.getValue());
    }

    private static final class ScriptPair {
        private String up;
        private String down;
        private Resource upSource;
        private Resource downSource;

        SqlMigrationUnit toUnit(String identifier) {
            if (up == null) {
                throw new DiscoveryException(
                        "Migration '%s' has a down script but no up script".formatted(identifier));
            }
            if (down == null) {
                throw new DiscoveryException(
                        "Migration '%s' has an up script but no down script".formatted(identifier));
            }
            return new SqlMigrationUnit(identifier, up, down, checksum(up, down));
        }
    }
}
