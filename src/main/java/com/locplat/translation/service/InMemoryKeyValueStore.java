package com.locplat.translation.service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Process-local store with per-entry expiry, used when no Redis is configured.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, StoredValue> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public byte[] get(String key) {
        StoredValue stored = entries.get(key);
        if (stored == null) {
            return null;
        }
        if (stored.isExpired(clock.instant())) {
            entries.remove(key, stored);
            return null;
        }
        return stored.value();
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
        entries.put(key, new StoredValue(value, expiresAt));
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public long deleteMatching(String pattern) {
        Set<String> matching = keys(pattern);
        matching.forEach(entries::remove);
        return matching.size();
    }

    @Override
    public Set<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        Instant now = clock.instant();
        return entries.entrySet().stream()
                .filter(e -> !e.getValue().isExpired(now))
                .map(Map.Entry::getKey)
                .filter(key -> regex.matcher(key).matches())
                .collect(Collectors.toSet());
    }

    @Override
    public long increment(String key) {
        StoredValue updated = entries.compute(key, (k, current) -> {
            long next = 1;
            if (current != null && !current.isExpired(clock.instant())) {
                next = Long.parseLong(new String(current.value(), StandardCharsets.US_ASCII)) + 1;
            }
            return new StoredValue(Long.toString(next).getBytes(StandardCharsets.US_ASCII),
                    current == null ? null : current.expiresAt());
        });
        return Long.parseLong(new String(updated.value(), StandardCharsets.US_ASCII));
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private record StoredValue(byte[] value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
