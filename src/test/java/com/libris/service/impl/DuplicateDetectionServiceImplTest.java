package com.libris.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libris.config.DuplicateDetectionConfig;
import com.libris.exception.EmbeddingProviderException;
import com.libris.exception.EmbeddingStoreException;
import com.libris.mapper.SemanticSearchMapper;
import com.libris.model.dto.DuplicateDetectionDTO;
import com.libris.model.dto.SemanticSearchDTO;
import com.libris.model.enums.DuplicateMatchType;
import com.libris.model.enums.RecommendedAction;
import com.libris.model.vo.*;
import com.libris.service.ContentLibraryService;
import com.libris.service.EmbeddingService;
import com.libris.service.EmbeddingStoreService;
import com.libris.service.SemanticSearchService;
import com.libris.utils.ContentNormalizeUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DuplicateDetectionServiceImplTest {

    private static final Long OWNER = 42L;
    private static final String STRUCTURED = "# Onboarding\n- create account\n- read handbook";

    @Mock private ContentLibraryService contentLibraryService;
    @Mock private EmbeddingService embeddingService;
    @Mock private SemanticSearchService semanticSearchService;

    private DuplicateDetectionConfig config;
    private DuplicateDetectionServiceImpl detector;

    @BeforeEach
    void setUp() {
        config = new DuplicateDetectionConfig();
        detector = new DuplicateDetectionServiceImpl(contentLibraryService, embeddingService, semanticSearchService, config);

        lenient().when(contentLibraryService.findExactContentMatches(anyLong(), anyString())).thenReturn(List.of());
        lenient().when(contentLibraryService.listOwnerItems(anyLong(), anyInt())).thenReturn(List.of());
        lenient().when(contentLibraryService.findByIds(anyLong(), any())).thenAnswer(invocation -> {
            Collection<Long> ids = invocation.getArgument(1);
            return ids.stream().map(DuplicateDetectionServiceImplTest::canonical).collect(Collectors.toList());
        });
        lenient().when(embeddingService.generate(anyString())).thenReturn(embedding());
        lenient().when(semanticSearchService.rank(any(), anyLong(), any())).thenReturn(List.of());
    }

    // =========================================================================
    //  阶段1: 精确匹配
    // =========================================================================

    @Nested
    @DisplayName("exact stage")
    class ExactStage {

        @Test
        void exactHitShortCircuitsRemainingStages() {
            when(contentLibraryService.findExactContentMatches(OWNER, ContentNormalizeUtils.normalize(STRUCTURED)))
                .thenReturn(List.of(canonical(7L)));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null);

            assertThat(matches).hasSize(1);
            DuplicateMatchVO match = matches.get(0);
            assertThat(match.getExistingItemId()).isEqualTo(7L);
            assertThat(match.getSimilarity()).isEqualTo(1.0);
            assertThat(match.getMatchType()).isEqualTo(DuplicateMatchType.EXACT);
            assertThat(match.getConfidence()).isEqualTo(1.0);
            assertThat(match.getShouldMerge()).isTrue();
            assertThat(match.getCanonicalId()).isEqualTo(7L);

            verify(contentLibraryService, never()).listOwnerItems(anyLong(), anyInt());
            verify(embeddingService, never()).generate(anyString());
            verify(semanticSearchService, never()).rank(any(), anyLong(), any());
        }

        @Test
        void aliasResolvesToItsCanonicalItem() {
            when(contentLibraryService.findExactContentMatches(anyLong(), anyString()))
                .thenReturn(List.of(alias(9L, 3L), ItemRefVO.builder().id(11L).isCanonical(false).build()));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null);

            assertThat(matches).extracting(DuplicateMatchVO::getExistingItemId).containsExactly(9L, 11L);
            assertThat(matches).extracting(DuplicateMatchVO::getCanonicalId).containsExactly(3L, 11L);
        }

        @Test
        void disabledExactStageIsNotQueried() {
            detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER,
                DuplicateDetectionDTO.builder().enableExact(false).build());

            verify(contentLibraryService, never()).findExactContentMatches(anyLong(), anyString());
            verify(contentLibraryService).listOwnerItems(anyLong(), anyInt());
        }

        @Test
        void storageFailureFallsThroughToLaterStages() {
            when(contentLibraryService.findExactContentMatches(anyLong(), anyString()))
                .thenThrow(new EmbeddingStoreException("db down", new RuntimeException()));
            when(contentLibraryService.listOwnerItems(anyLong(), anyInt()))
                .thenReturn(List.of(withContent(5L, STRUCTURED)));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null);

            assertThat(matches).extracting(DuplicateMatchVO::getMatchType).containsExactly(DuplicateMatchType.STRUCTURAL);
        }
    }

    // =========================================================================
    //  阶段2: 结构相似度
    // =========================================================================

    @Nested
    @DisplayName("structural stage")
    class StructuralStage {

        @Test
        void candidatePoolIsOverFetchedByConfiguredFactor() {
            detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null);
            verify(contentLibraryService).listOwnerItems(OWNER, 25);

            detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER,
                DuplicateDetectionDTO.builder().maxCandidates(4).candidatePoolFactor(2).build());
            verify(contentLibraryService).listOwnerItems(OWNER, 8);
        }

        @Test
        void structuralMatchCarriesFixedConfidenceAndMergeFlag() {
            when(contentLibraryService.listOwnerItems(anyLong(), anyInt()))
                .thenReturn(List.of(withContent(5L, STRUCTURED), withContent(6L, "no structure here")));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER,
                DuplicateDetectionDTO.builder().enableSemantic(false).build());

            assertThat(matches).hasSize(1);
            assertThat(matches.get(0).getExistingItemId()).isEqualTo(5L);
            assertThat(matches.get(0).getSimilarity()).isEqualTo(1.0);
            assertThat(matches.get(0).getConfidence()).isEqualTo(0.8);
            assertThat(matches.get(0).getShouldMerge()).isTrue();
        }

        @Test
        void nearDuplicateWithAddedParagraphIsFlaggedWithoutMerge() {
            String original = "# Deployment guide\n- review the checklist before starting\n"
                + String.join(" ", Collections.nCopies(491, "alpha"));
            String extended = original + "\n\n" + String.join(" ", Collections.nCopies(25, "bravo"))
                + "\n" + String.join(" ", Collections.nCopies(25, "bravo"));
            when(contentLibraryService.listOwnerItems(anyLong(), anyInt()))
                .thenReturn(List.of(withContent(8L, original)));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates(extended, "guide v2", OWNER,
                DuplicateDetectionDTO.builder().enableSemantic(false).build());

            assertThat(matches).hasSize(1);
            assertThat(matches.get(0).getSimilarity()).isGreaterThan(0.8).isLessThan(1.0);
            assertThat(matches.get(0).getShouldMerge()).isFalse();
        }
    }

    // =========================================================================
    //  阶段3: 语义相似度与合并
    // =========================================================================

    @Nested
    @DisplayName("semantic stage and fusion")
    class SemanticStage {

        @Test
        void semanticStageExcludesStructuralHitsAndOverFetches() {
            when(contentLibraryService.listOwnerItems(anyLong(), anyInt()))
                .thenReturn(List.of(withContent(5L, STRUCTURED)));

            detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null);

            ArgumentCaptor<SemanticSearchDTO> captor = ArgumentCaptor.forClass(SemanticSearchDTO.class);
            verify(semanticSearchService).rank(any(), eq(OWNER), captor.capture());
            assertThat(captor.getValue().getExcludeIds()).containsExactly(5L);
            assertThat(captor.getValue().getLimit()).isEqualTo(10);
            assertThat(captor.getValue().getThreshold()).isEqualTo(0.8);
        }

        @Test
        void sameItemFromBothStagesKeepsHigherSimilarity() {
            when(contentLibraryService.listOwnerItems(anyLong(), anyInt()))
                .thenReturn(List.of(withContent(5L, STRUCTURED)));
            // 结构 1.0 高于语义 0.93
            when(semanticSearchService.rank(any(), anyLong(), any()))
                .thenReturn(List.of(similarity(5L, 0.93), similarity(6L, 0.97)));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null);

            assertThat(matches).extracting(DuplicateMatchVO::getExistingItemId).containsExactly(5L, 6L);
            assertThat(matches.get(0).getMatchType()).isEqualTo(DuplicateMatchType.STRUCTURAL);
            assertThat(matches.get(1).getMatchType()).isEqualTo(DuplicateMatchType.SEMANTIC);
            assertThat(matches.get(1).getConfidence()).isEqualTo(0.85);
            assertThat(matches.get(1).getShouldMerge()).isTrue();
        }

        @Test
        void semanticMatchReplacesWeakerStructuralMatch() {
            String similar = "# Onboarding\n- create an account today\n- read the handbook";
            when(contentLibraryService.listOwnerItems(anyLong(), anyInt()))
                .thenReturn(List.of(withContent(5L, similar)));
            when(semanticSearchService.rank(any(), anyLong(), any()))
                .thenReturn(List.of(similarity(5L, 0.995)));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null);

            assertThat(matches).hasSize(1);
            assertThat(matches.get(0).getMatchType()).isEqualTo(DuplicateMatchType.SEMANTIC);
            assertThat(matches.get(0).getSimilarity()).isEqualTo(0.995);
        }

        @Test
        void returnsOnlyTopCandidatesSortedDescending() {
            when(semanticSearchService.rank(any(), anyLong(), any())).thenReturn(List.of(
                similarity(1L, 0.99), similarity(2L, 0.97), similarity(3L, 0.95),
                similarity(4L, 0.91), similarity(5L, 0.88), similarity(6L, 0.85)));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates("anything at all", "n", OWNER,
                DuplicateDetectionDTO.builder().maxCandidates(3).build());

            assertThat(matches).extracting(DuplicateMatchVO::getExistingItemId).containsExactly(1L, 2L, 3L);
            assertThat(matches).extracting(DuplicateMatchVO::getSimilarity).containsExactly(0.99, 0.97, 0.95);
        }

        @Test
        void equalSimilaritiesAreOrderedByItemId() {
            when(contentLibraryService.listOwnerItems(anyLong(), anyInt()))
                .thenReturn(List.of(withContent(30L, STRUCTURED), withContent(10L, STRUCTURED)));
            when(semanticSearchService.rank(any(), anyLong(), any()))
                .thenReturn(List.of(similarity(20L, 1.0)));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null);

            assertThat(matches).extracting(DuplicateMatchVO::getExistingItemId).containsExactly(10L, 20L, 30L);
            assertThat(matches).extracting(DuplicateMatchVO::getExistingItemId).doesNotHaveDuplicates();
        }

        @Test
        void providerFailureKeepsStructuralMatches() {
            when(contentLibraryService.listOwnerItems(anyLong(), anyInt()))
                .thenReturn(List.of(withContent(5L, STRUCTURED)));
            when(embeddingService.generate(anyString()))
                .thenThrow(new EmbeddingProviderException("openai", 429, "rate limited", null));

            List<DuplicateMatchVO> matches = detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null);

            assertThat(matches).extracting(DuplicateMatchVO::getExistingItemId).containsExactly(5L);
            verify(semanticSearchService, never()).rank(any(), anyLong(), any());
        }

        @Test
        void everyStageFailingYieldsEmptyResult() {
            when(contentLibraryService.findExactContentMatches(anyLong(), anyString()))
                .thenThrow(new EmbeddingStoreException("db down", null));
            when(contentLibraryService.listOwnerItems(anyLong(), anyInt()))
                .thenThrow(new EmbeddingStoreException("db down", null));
            when(embeddingService.generate(anyString()))
                .thenThrow(new EmbeddingProviderException("openai", "unavailable"));

            assertThat(detector.checkForDuplicates(STRUCTURED, "onboarding", OWNER, null)).isEmpty();
        }

        @Test
        void semanticHitsForMissingItemsAreDropped() {
            when(semanticSearchService.rank(any(), anyLong(), any()))
                .thenReturn(List.of(similarity(1L, 0.99), similarity(2L, 0.95)));
            // 条目1已被删除
            doReturn(List.of(alias(2L, 100L))).when(contentLibraryService).findByIds(anyLong(), any());

            List<DuplicateMatchVO> matches = detector.checkForDuplicates("text", "n", OWNER, null);

            assertThat(matches).hasSize(1);
            assertThat(matches.get(0).getExistingItemId()).isEqualTo(2L);
            assertThat(matches.get(0).getCanonicalId()).isEqualTo(100L);
        }
    }

    @Test
    void staleVectorOfAnotherModelKeepsSemanticStageWorking() {
        EmbeddingStoreService store = mock(EmbeddingStoreService.class);
        when(store.queryByOwner(eq(OWNER), any())).thenReturn(List.of(
            EmbeddingVectorVO.builder().itemId(1L).ownerId(OWNER).dimensions(3).vector(new float[]{1f, 0f, 0f}).build(),
            EmbeddingVectorVO.builder().itemId(2L).ownerId(OWNER).dimensions(2).vector(new float[]{1f, 0f}).build()));
        SemanticSearchServiceImpl realSearch = new SemanticSearchServiceImpl(store, embeddingService, config,
            mock(SemanticSearchMapper.class), new ObjectMapper());
        DuplicateDetectionServiceImpl cascade = new DuplicateDetectionServiceImpl(contentLibraryService, embeddingService,
            realSearch, config);
        when(embeddingService.generate(anyString())).thenReturn(EmbeddingResultVO.builder()
            .vector(new float[]{1f, 0f, 0f})
            .dimensions(3)
            .build());

        List<DuplicateMatchVO> matches = cascade.checkForDuplicates("plain text", "n", OWNER,
            DuplicateDetectionDTO.builder().enableStructural(false).build());

        assertThat(matches).extracting(DuplicateMatchVO::getExistingItemId).containsExactly(1L);
        assertThat(matches.get(0).getMatchType()).isEqualTo(DuplicateMatchType.SEMANTIC);
    }

    // =========================================================================
    //  参数与摘要
    // =========================================================================

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> detector.checkForDuplicates("text", "n", OWNER,
            DuplicateDetectionDTO.builder().threshold(1.5).build()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("getDuplicateSummary()")
    class Summary {

        @Test
        void noMatchesRecommendsImport() {
            DuplicateSummaryVO summary = detector.getDuplicateSummary("text", "n", OWNER, null);

            assertThat(summary.getHasDuplicates()).isFalse();
            assertThat(summary.getRecommendedAction()).isEqualTo(RecommendedAction.IMPORT);
            assertThat(summary.getHighestSimilarity()).isEqualTo(0.0);
        }

        @Test
        void exactMatchRecommendsSkip() {
            when(contentLibraryService.findExactContentMatches(anyLong(), anyString())).thenReturn(List.of(canonical(7L)));

            DuplicateSummaryVO summary = detector.getDuplicateSummary(STRUCTURED, "n", OWNER, null);

            assertThat(summary.getRecommendedAction()).isEqualTo(RecommendedAction.SKIP);
            assertThat(summary.getDuplicateCount()).isEqualTo(1);
        }

        @Test
        void strongSemanticMatchRecommendsMergeAndWeakOneReview() {
            when(semanticSearchService.rank(any(), anyLong(), any())).thenReturn(List.of(similarity(1L, 0.92)));
            assertThat(detector.getDuplicateSummary("text", "n", OWNER, null).getRecommendedAction())
                .isEqualTo(RecommendedAction.MERGE);

            when(semanticSearchService.rank(any(), anyLong(), any())).thenReturn(List.of(similarity(1L, 0.85)));
            DuplicateSummaryVO summary = detector.getDuplicateSummary("text", "n", OWNER, null);
            assertThat(summary.getRecommendedAction()).isEqualTo(RecommendedAction.REVIEW);
            assertThat(summary.getHighestSimilarity()).isEqualTo(0.85);
        }
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private static ItemRefVO canonical(Long id) {
        return ItemRefVO.builder().id(id).isCanonical(true).build();
    }

    private static ItemRefVO alias(Long id, Long canonicalId) {
        return ItemRefVO.builder().id(id).isCanonical(false).canonicalId(canonicalId).build();
    }

    private static ItemRefVO withContent(Long id, String content) {
        return ItemRefVO.builder().id(id).content(content).isCanonical(true).build();
    }

    private static SimilarityResultVO similarity(Long itemId, double value) {
        return SimilarityResultVO.builder().itemId(itemId).similarity(value).build();
    }

    private static EmbeddingResultVO embedding() {
        return EmbeddingResultVO.builder()
            .vector(new float[]{0.1f, 0.2f, 0.3f})
            .tokenCount(3)
            .dimensions(3)
            .provider("openai")
            .model("text-embedding-3-small")
            .build();
    }
}
