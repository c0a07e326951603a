package com.fastchat.memory.service;

import com.fastchat.memory.api.dto.Message;
import reactor.core.publisher.Flux;

/**
 * External similarity index. Only consulted when the redis-vector backend is configured.
 */
public interface SimilarMessageSearch {

    /** Most similar first, at most {@code limit}, each scoring at least {@code threshold}. */
    Flux<Message> findSimilar(String sessionId, String query, double threshold, int limit);
}
