package com.example.podcast_backend.service.storage;

import com.example.podcast_backend.util.LocatorKind;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects the backend of a stored locator from its scheme or domain. The kind is always derived
 * from the locator itself, never from which backend is currently configured as primary.
 */
public class LocatorParser {
    private static final Pattern SPREAKER_EPISODE = Pattern.compile("/episodes?/(\\d+)");

    private final String r2Bucket;
    private final String r2PublicHost;
    private final String gcsBucket;

    public LocatorParser(String r2Bucket, String r2PublicBaseUrl, String gcsBucket) {
        this.r2Bucket = blankToNull(r2Bucket);
        this.r2PublicHost = hostOf(r2PublicBaseUrl);
        this.gcsBucket = blankToNull(gcsBucket);
    }

    public ParsedLocator parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("locator is blank");
        }
        String s = raw.trim();
        String lower = s.toLowerCase(Locale.ROOT);

        if (lower.startsWith("r2://")) {
            return bucketAndKey(LocatorKind.PRIMARY_CLOUD, s.substring(5), s);
        }
        if (lower.startsWith("gs://")) {
            return bucketAndKey(LocatorKind.LEGACY_CLOUD, s.substring(5), s);
        }
        if (lower.startsWith("spreaker://")) {
            String rest = s.substring("spreaker://".length());
            String id = rest.startsWith("episode/") ? rest.substring("episode/".length()) : rest;
            return new ParsedLocator(LocatorKind.EXTERNAL_STREAM, null, id, s);
        }
        if (lower.startsWith("file:")) {
            String path = s.substring(5);
            if (path.startsWith("//")) path = path.substring(2);
            return new ParsedLocator(LocatorKind.LOCAL_CACHE, null, path, s);
        }
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return parseHttp(s);
        }

        // bare "bucket/key" as older rows stored it
        int slash = s.indexOf('/');
        if (slash > 0) {
            String first = s.substring(0, slash);
            if (first.equals(r2Bucket)) {
                return new ParsedLocator(LocatorKind.PRIMARY_CLOUD, first, s.substring(slash + 1), s);
            }
            if (first.equals(gcsBucket)) {
                return new ParsedLocator(LocatorKind.LEGACY_CLOUD, first, s.substring(slash + 1), s);
            }
        }
        return new ParsedLocator(LocatorKind.LOCAL_CACHE, null, s, s);
    }

    private ParsedLocator parseHttp(String s) {
        URI uri = URI.create(s);
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getPath() == null ? "" : uri.getPath().replaceFirst("^/+", "");

        if (host.endsWith(".r2.cloudflarestorage.com")) {
            return bucketAndKey(LocatorKind.PRIMARY_CLOUD, path, s);
        }
        if (r2PublicHost != null && host.equals(r2PublicHost)) {
            return new ParsedLocator(LocatorKind.PRIMARY_CLOUD, r2Bucket, path, s);
        }
        if (host.equals("storage.googleapis.com") || host.equals("storage.cloud.google.com")) {
            return bucketAndKey(LocatorKind.LEGACY_CLOUD, path, s);
        }
        if (host.endsWith(".storage.googleapis.com")) {
            String bucket = host.substring(0, host.length() - ".storage.googleapis.com".length());
            return new ParsedLocator(LocatorKind.LEGACY_CLOUD, bucket, path, s);
        }
        if (host.equals("spreaker.com") || host.endsWith(".spreaker.com")) {
            Matcher m = SPREAKER_EPISODE.matcher(uri.getPath() == null ? "" : uri.getPath());
            if (m.find()) {
                return new ParsedLocator(LocatorKind.EXTERNAL_STREAM, null, m.group(1), s);
            }
        }
        throw new IllegalArgumentException("Unrecognised storage host in locator: " + host);
    }

    private static ParsedLocator bucketAndKey(LocatorKind kind, String rest, String raw) {
        int slash = rest.indexOf('/');
        if (slash <= 0 || slash == rest.length() - 1) {
            throw new IllegalArgumentException("Locator needs bucket and key: " + raw);
        }
        return new ParsedLocator(kind, rest.substring(0, slash), rest.substring(slash + 1), raw);
    }

    private static String hostOf(String url) {
        if (url == null || url.isBlank()) return null;
        String host = URI.create(url.trim()).getHost();
        return host == null ? null : host.toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
