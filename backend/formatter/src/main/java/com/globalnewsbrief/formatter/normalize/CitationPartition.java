package com.globalnewsbrief.formatter.normalize;

import com.globalnewsbrief.core.model.Article;
import com.globalnewsbrief.core.model.Citation;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a shared citation pool across articles in source order.
 *
 * <p>Each article takes {@code k = clamp(poolSize / articleCount, 1, 3)} consecutive entries,
 * starting at {@code (index * k) mod poolSize} and wrapping around the pool. With fewer citations
 * than articles the pool is reused from the start; no article ever holds the same entry twice.
 */
final class CitationPartition {
    private CitationPartition() {
    }

    static int perArticle(int poolSize, int articleCount) {
        if (poolSize <= 0 || articleCount <= 0) {
            return 0;
        }
        return Math.max(Article.MIN_CITATIONS, Math.min(Article.MAX_CITATIONS, poolSize / articleCount));
    }

    static List<Citation> slice(List<Citation> pool, int index, int articleCount) {
        int perArticle = perArticle(pool.size(), articleCount);
        if (perArticle == 0) {
            return List.of();
        }
        int start = (int) (((long) index * perArticle) % pool.size());
        List<Citation> slice = new ArrayList<>(perArticle);
        for (int offset = 0; offset < perArticle; offset++) {
            slice.add(pool.get((start + offset) % pool.size()));
        }
        return List.copyOf(slice);
    }
}
