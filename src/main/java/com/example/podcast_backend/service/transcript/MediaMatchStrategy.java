package com.example.podcast_backend.service.transcript;

import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.repository.MediaItemRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Ways to find the media a filename refers to, tried in declaration order. Each returns its
 * candidates oldest first.
 */
public enum MediaMatchStrategy {
    EXACT_FILENAME {
        @Override
        List<MediaItem> candidates(UUID ownerId, String query, MediaItemRepository repository) {
            return repository.findByOwnerIdAndFilenameOrderByCreatedAtAsc(ownerId, query.trim());
        }
    },
    BASENAME {
        @Override
        List<MediaItem> candidates(UUID ownerId, String query, MediaItemRepository repository) {
            String base = FilenameVariants.basename(query);
            if (base.isEmpty()) return List.of();
            return repository.findByOwnerIdAndFilenameEndingWithIgnoreCaseOrderByCreatedAtAsc(ownerId, base).stream()
                    .filter(m -> FilenameVariants.basename(m.getFilename()).equals(base))
                    .toList();
        }
    },
    NORMALIZED_VARIANT {
        @Override
        List<MediaItem> candidates(UUID ownerId, String query, MediaItemRepository repository) {
            Set<String> wanted = FilenameVariants.normalizedVariants(query);
            Map<UUID, MediaItem> hits = new LinkedHashMap<>();
            for (String variant : wanted) {
                for (MediaItem m : repository.findByOwnerIdAndFilenameEndingWithIgnoreCaseOrderByCreatedAtAsc(ownerId, variant)) {
                    if (wanted.contains(FilenameVariants.normalize(m.getFilename()))) {
                        hits.putIfAbsent(m.getId(), m);
                    }
                }
            }
            return hits.values().stream()
                    .sorted(Comparator.comparing(MediaItem::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder())))
                    .toList();
        }
    };

    abstract List<MediaItem> candidates(UUID ownerId, String query, MediaItemRepository repository);
}
