package com.trailerlink.backend.modules.trailer.application;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.trailerlink.backend.modules.trailer.domain.PublishedTrailer;
import com.trailerlink.backend.modules.trailer.infrastructure.persistence.PublishedTrailerRepository;

@Service
@Transactional(readOnly = true)
public class TrailerLookupService {

    public static final int DEFAULT_RECENT_LIMIT = 10;
    static final int MAX_RECENT_LIMIT = 100;

    private final PublishedTrailerRepository publishedTrailerRepository;

    public TrailerLookupService(PublishedTrailerRepository publishedTrailerRepository) {
        this.publishedTrailerRepository = publishedTrailerRepository;
    }

    public Optional<String> lookup(String sourceId) {
        if (!StringUtils.hasText(sourceId)) {
            return Optional.empty();
        }
        return publishedTrailerRepository.findById(sourceId.trim())
                .map(PublishedTrailer::getTargetUrl);
    }

    public List<PublishedTrailer> recentPublished() {
        return recentPublished(DEFAULT_RECENT_LIMIT);
    }

    /**
     * Most recently approved mappings first; {@code limit} is clamped to 1..{@value #MAX_RECENT_LIMIT}.
     */
    public List<PublishedTrailer> recentPublished(int limit) {
        int clamped = Math.min(Math.max(limit, 1), MAX_RECENT_LIMIT);
        return publishedTrailerRepository.findAllByOrderByApprovedAtDescSourceIdAsc(PageRequest.of(0, clamped));
    }
}
