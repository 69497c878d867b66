package com.locplat.translation.service;

import com.locplat.translation.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Turns cached strings into stored bytes. Payloads above {@link #COMPRESSION_THRESHOLD}
 * bytes are zlib-compressed; reads detect compression by trying to inflate.
 */
@Component
public class CachePayloadCodec {

    private static final Logger logger = LoggerFactory.getLogger(CachePayloadCodec.class);

    static final int COMPRESSION_THRESHOLD = 1000;

    public CacheEntry encode(String key, String value, Duration ttl) {
        byte[] raw = value.getBytes(StandardCharsets.UTF_8);
        long ttlSeconds = ttl == null ? 0 : ttl.getSeconds();
        if (raw.length <= COMPRESSION_THRESHOLD) {
            return new CacheEntry(key, raw, ttlSeconds, false);
        }
        return new CacheEntry(key, deflate(raw), ttlSeconds, true);
    }

    /**
     * Restores the string written by {@link #encode}. Bytes that are not a zlib
     * stream are returned as UTF-8 text.
     */
    public String decode(byte[] stored) {
        if (stored == null) {
            return null;
        }
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(stored);
            ByteArrayOutputStream out = new ByteArrayOutputStream(stored.length * 4);
            byte[] buffer = new byte[4096];
            while (!inflater.finished()) {
                int count = inflater.inflate(buffer);
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    // Truncated or not compressed at all.
                    return new String(stored, StandardCharsets.UTF_8);
                }
                out.write(buffer, 0, count);
            }
            return out.toString(StandardCharsets.UTF_8);
        } catch (DataFormatException e) {
            logger.debug("Cached payload is not zlib data, reading it as text");
            return new String(stored, StandardCharsets.UTF_8);
        } finally {
            inflater.end();
        }
    }

    private byte[] deflate(byte[] raw) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(raw);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length / 2);
            byte[] buffer = new byte[4096];
            while (!deflater.finished()) {
                int count = deflater.deflate(buffer);
                out.write(buffer, 0, count);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }
}
