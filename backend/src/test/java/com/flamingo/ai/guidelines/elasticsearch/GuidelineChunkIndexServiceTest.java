package com.flamingo.ai.guidelines.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import com.flamingo.ai.guidelines.domain.model.RetrievalFilters;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GuidelineChunkIndexServiceTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private GuidelineChunkIndexService indexService;

  @BeforeEach
  void setUp() {
    indexService =
        new GuidelineChunkIndexService(
            elasticsearchClient, new SimpleMeterRegistry(), "test-chunks", 4);
  }

  @Nested
  @DisplayName("scopeFilters")
  class ScopeFilterTests {

    @Test
    @DisplayName("should scope to the document only when there are no filters")
    void shouldScopeToDocument() {
      List<Query> scope = indexService.scopeFilters("kr-1", RetrievalFilters.none());

      assertThat(scope)
          .singleElement()
          .satisfies(
              q -> {
                assertThat(q.isTerm()).isTrue();
                assertThat(q.term().field()).isEqualTo("docId");
                assertThat(q.term().value().stringValue()).isEqualTo("kr-1");
              });
    }

    @Test
    @DisplayName("should AND section prefix, types and the page overlap window")
    void shouldCombineFilters() {
      RetrievalFilters filters =
          new RetrievalFilters(" 3 Лечение ", Set.of(ChunkType.RECOMMENDATION), 5, 9);

      List<Query> scope = indexService.scopeFilters("kr-1", filters);

      assertThat(scope).hasSize(5);
      assertThat(scope.get(1).prefix().field()).isEqualTo("sectionPath");
      assertThat(scope.get(1).prefix().value()).isEqualTo("3 Лечение");
      assertThat(scope.get(2).terms().field()).isEqualTo("chunkType");
      assertThat(scope.get(2).terms().terms().value())
          .extracting(FieldValue::stringValue)
          .containsExactly("recommendation");
      assertThat(scope.get(3).range().number().field()).isEqualTo("pageStart");
      assertThat(scope.get(3).range().number().lte()).isEqualTo(9.0);
      assertThat(scope.get(4).range().number().field()).isEqualTo("pageEnd");
      assertThat(scope.get(4).range().number().gte()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("should accept an open-ended page window")
    void shouldAcceptOpenWindow() {
      RetrievalFilters filters = new RetrievalFilters(null, Set.of(), 7, null);

      List<Query> scope = indexService.scopeFilters("kr-1", filters);

      assertThat(scope).hasSize(2);
      assertThat(scope.get(1).range().number().field()).isEqualTo("pageEnd");
    }
  }

  @Test
  @DisplayName("should not query for empty entity terms or a zero neighbour limit")
  void shouldShortCircuitEmptyLookups() {
    assertThat(indexService.findByEntityMentions("kr-1", List.of(), Set.of(), 5)).isEmpty();
    assertThat(indexService.findSectionNeighbors("kr-1", "3 Лечение", 2, 0)).isEmpty();
    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("should keep excluded chunk ids out of the entity lookup")
  void shouldExcludeIdsFromEntityLookup() {
    // When
    Query query =
        indexService.entityMentionsQuery("kr-1", List.of("Эналаприл"), List.of("s1", "n4"));

    // Then
    assertThat(query.bool().filter())
        .extracting(q -> q.isTerm() ? q.term().field() : q.terms().field())
        .containsExactly("docId", "entityMentions");
    assertThat(query.bool().mustNot())
        .singleElement()
        .satisfies(q -> assertThat(q.ids().values()).containsExactly("s1", "n4"));
  }

  @Test
  @DisplayName("should not add an exclusion clause when nothing is excluded")
  void shouldOmitEmptyExclusion() {
    Query query = indexService.entityMentionsQuery("kr-1", List.of("Эналаприл"), Set.of());

    assertThat(query.bool().mustNot()).isEmpty();
  }

  @Test
  @DisplayName("should store the chunk type value and leave out an empty embedding")
  void shouldConvertToDocument() {
    GuidelineChunk chunk =
        GuidelineChunk.builder()
            .chunkId("c1")
            .docId("kr-1")
            .sectionPath("3 Лечение")
            .chunkType(ChunkType.ALGORITHM)
            .text("Алгоритм ведения")
            .entityMentions(List.of("Алгоритм"))
            .embedding(List.of())
            .build();

    Map<String, Object> document = indexService.convertToDocument(chunk);

    assertThat(document).containsEntry("chunkType", "algorithm").doesNotContainKey("embedding");
    GuidelineChunk restored = indexService.convertFromDocument(withId(document, "c1"));
    assertThat(restored.getChunkId()).isEqualTo("c1");
    assertThat(restored.getChunkType()).isEqualTo(ChunkType.ALGORITHM);
    assertThat(restored.getEntityMentions()).containsExactly("Алгоритм");
  }

  private static Map<String, Object> withId(Map<String, Object> document, String id) {
    Map<String, Object> source = new HashMap<>(document);
    source.put("id", id);
    return source;
  }
}
