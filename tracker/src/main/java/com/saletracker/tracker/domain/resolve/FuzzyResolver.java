package com.saletracker.tracker.domain.resolve;

import com.saletracker.tracker.domain.catalog.CatalogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves free text to a catalog identifier by token-set similarity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FuzzyResolver {

    public static final int MIN_SCORE = 70;

    private final CatalogStore catalogStore;

    /**
     * Resolve against the full catalog, waiting for its first sync to finish.
     */
    public Optional<ResolvedItem> resolve(String query) {
        if (!catalogStore.awaitInitialized()) {
            log.warn("Interrupted while waiting for the catalog, cannot resolve '{}'", query);
            return Optional.empty();
        }
        if (catalogStore.isEmpty()) {
            log.warn("Catalog is empty, cannot resolve '{}'", query);
            return Optional.empty();
        }
        return resolve(query, catalogStore.entries());
    }

    /**
     * Resolve against a caller-supplied name to identifier universe, for example only the items
     * a subscriber already monitors. The first best-scoring name in iteration order wins.
     */
    public Optional<ResolvedItem> resolve(String query, Map<String, Long> universe) {
        if (query == null || query.isBlank() || universe == null || universe.isEmpty()) {
            return Optional.empty();
        }
        String bestName = null;
        Long bestId = null;
        var bestScore = -1;
        for (var entry : universe.entrySet()) {
            var score = FuzzySearch.tokenSetRatio(query, entry.getKey());
            if (score > bestScore) {
                bestScore = score;
                bestName = entry.getKey();
                bestId = entry.getValue();
                if (score == 100) {
                    break;
                }
            }
        }

        if (bestScore < MIN_SCORE || bestId == null) {
            log.info("No match for '{}' (best: '{}' score={})", query, bestName, bestScore);
            return Optional.empty();
        }
        log.info("Resolved '{}' to '{}' (appid={}, score={})", query, bestName, bestId, bestScore);
        return Optional.of(new ResolvedItem(bestId, bestName, bestScore));
    }
}
