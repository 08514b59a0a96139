package com.trailerlink.backend.modules.trailer.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.trailerlink.backend.modules.trailer.infrastructure.persistence.PublishedTrailerRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class TrailerLookupServiceTest {

    @Mock
    PublishedTrailerRepository publishedTrailerRepository;

    @InjectMocks
    TrailerLookupService service;

    @Test
    void blankKeyNeverHitsTheStore() {
        assertThat(service.lookup("  ")).isEmpty();
        assertThat(service.lookup(null)).isEmpty();
        verifyNoInteractions(publishedTrailerRepository);
    }

    @Test
    void unknownKeyIsEmpty() {
        when(publishedTrailerRepository.findById("tt0000000")).thenReturn(Optional.empty());

        assertThat(service.lookup(" tt0000000 ")).isEmpty();
    }

    @Test
    void recentLimitIsClamped() {
        service.recentPublished(-5);
        service.recentPublished(1_000);
        service.recentPublished();

        verify(publishedTrailerRepository).findAllByOrderByApprovedAtDescSourceIdAsc(PageRequest.of(0, 1));
        verify(publishedTrailerRepository).findAllByOrderByApprovedAtDescSourceIdAsc(PageRequest.of(0, 100));
        verify(publishedTrailerRepository).findAllByOrderByApprovedAtDescSourceIdAsc(PageRequest.of(0, 10));
    }
}
