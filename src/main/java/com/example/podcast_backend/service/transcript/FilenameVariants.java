package com.example.podcast_backend.service.transcript;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Filename normalisation used when matching media across environments.
 */
public final class FilenameVariants {
    private FilenameVariants() {
    }

    /** Strips scheme, bucket, directories and query string. */
    public static String basename(String nameOrLocator) {
        if (nameOrLocator == null) return "";
        String s = nameOrLocator.trim().replace('\\', '/');
        int query = s.indexOf('?');
        if (query >= 0) s = s.substring(0, query);
        int scheme = s.indexOf("://");
        if (scheme >= 0) s = s.substring(scheme + 3);
        return s.substring(s.lastIndexOf('/') + 1);
    }

    public static String normalize(String nameOrLocator) {
        return basename(nameOrLocator).toLowerCase(Locale.ROOT);
    }

    /** Lower-cased basename plus its underscore/dash swaps. */
    public static Set<String> normalizedVariants(String nameOrLocator) {
        String n = normalize(nameOrLocator);
        Set<String> out = new LinkedHashSet<>();
        if (n.isEmpty()) return out;
        out.add(n);
        out.add(n.replace('_', '-'));
        out.add(n.replace('-', '_'));
        return out;
    }

    /** Stems to probe in transcript archives, most specific first. */
    public static Set<String> stemVariants(String nameOrLocator) {
        String base = basename(nameOrLocator);
        int dot = base.lastIndexOf('.');
        String stem = dot > 0 ? base.substring(0, dot) : base;
        Set<String> out = new LinkedHashSet<>();
        if (stem.isBlank()) return out;
        String lower = stem.toLowerCase(Locale.ROOT);
        out.add(stem);
        out.add(lower);
        out.add(stem.replace('_', '-'));
        out.add(stem.replace('-', '_'));
        out.add(lower.replace('_', '-'));
        out.add(lower.replace('-', '_'));
        out.add(stem.replaceAll("[^A-Za-z0-9._-]", "_"));
        return out;
    }
}
