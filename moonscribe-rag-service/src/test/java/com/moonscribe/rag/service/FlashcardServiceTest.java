package com.moonscribe.rag.service;

import com.moonscribe.rag.context.ContextSelector;
import com.moonscribe.rag.credit.CreditAction;
import com.moonscribe.rag.credit.CreditSettlement;
import com.moonscribe.rag.credit.KeyResolution;
import com.moonscribe.rag.credit.KeyResolver;
import com.moonscribe.rag.credit.KeySource;
import com.moonscribe.rag.dto.Flashcard;
import com.moonscribe.rag.dto.FlashcardRequest;
import com.moonscribe.rag.dto.FlashcardResponse;
import com.moonscribe.rag.exception.StructuredOutputException;
import com.moonscribe.rag.exception.UpstreamProviderException;
import com.moonscribe.rag.ingest.EmbeddingBatcher;
import com.moonscribe.rag.llm.ChatCompletion;
import com.moonscribe.rag.llm.CompletionOrchestrator;
import com.moonscribe.rag.llm.Embedding;
import com.moonscribe.rag.llm.ProviderCredential;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.metrics.RagMetrics;
import com.moonscribe.rag.usage.UsageOperation;
import com.moonscribe.rag.usage.UsageRecorder;
import com.moonscribe.rag.parse.StructuredOutputParser;
import com.moonscribe.rag.query.QueryExpander;
import com.moonscribe.rag.vector.MetadataFilter;
import com.moonscribe.rag.vector.SearchHit;
import com.moonscribe.rag.vector.VectorIndexClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FlashcardService.
 */
@ExtendWith(MockitoExtension.class)
class FlashcardServiceTest {

    private static final ProviderCredential SERVER = new ProviderCredential(ProviderKind.OPENAI, "sk-server");
    private static final KeyResolution CREDITS =
            KeyResolution.credits(SERVER, "user-1", CreditAction.ASK_GPT35, 1, 10);
    private static final String FILLER = " covers definitions, worked examples and a short summary of the chapter.";

    @Mock
    private KeyResolver keyResolver;

    @Mock
    private EmbeddingBatcher batcher;

    @Mock
    private VectorIndexClient vectorIndex;

    @Mock
    private CompletionOrchestrator orchestrator;

    @Mock
    private CreditSettlement settlement;

    @Mock
    private UsageRecorder usage;

    @Mock
    private RagMetrics metrics;

    private FlashcardService service;

    @BeforeEach
    void setUp() {
        StructuredOutputParser parser = new StructuredOutputParser(List.of("flashcards", "cards"),
                new RagMetrics(new SimpleMeterRegistry()));
        service = new FlashcardService(keyResolver, batcher, vectorIndex, new ContextSelector(3, 20, 50),
                new QueryExpander(), orchestrator, parser, settlement, usage, metrics, 30, 10);
    }

    private static FlashcardRequest request(Integer count) {
        return new FlashcardRequest(List.of("bio.pdf", "chem.pdf"), null, null, null, count);
    }

    private void givenRetrieval(List<SearchHit> hits) {
        when(keyResolver.resolve(eq("user-1"), isNull(), eq(ProviderKind.OPENAI), any(CreditAction.class)))
                .thenReturn(CREDITS);
        when(keyResolver.embeddingKey(CREDITS)).thenReturn("sk-server");
        when(batcher.embedOne(anyString(), eq("sk-server"))).thenReturn(new Embedding(new float[]{1f, 0f}, 2));
        when(vectorIndex.query(any(), eq(30), any(MetadataFilter.class), eq(true))).thenReturn(hits);
    }

    private static List<SearchHit> twoSources() {
        return List.of(
                SearchHit.of("Cell biology" + FILLER, "bio.pdf", 0.9),
                SearchHit.of("Organic chemistry" + FILLER, "chem.pdf", 0.8),
                SearchHit.of("Genetics" + FILLER, "bio.pdf", 0.7));
    }

    private static ChatCompletion completion(String text) {
        return new ChatCompletion(text, 50, ProviderKind.OPENAI, "gpt-3.5-turbo");
    }

    private static String cards(String prefix, int n) {
        StringBuilder sb = new StringBuilder("{\"flashcards\":[");
        for (int i = 0; i < n; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"front\":\"").append(prefix).append(" Q").append(i)
                    .append("\",\"back\":\"").append(prefix).append(" A").append(i).append("\"}");
        }
        return sb.append("]}").toString();
    }

    @Nested
    @DisplayName("Generation")
    class Generation {

        @Test
        @DisplayName("Should generate per source, cap the total and bill once")
        void shouldGenerateAcrossSources() {
            // given
            givenRetrieval(twoSources());
            when(orchestrator.complete(anyString(), eq(ProviderKind.OPENAI), isNull(), eq(SERVER), any()))
                    .thenReturn(completion(cards("bio", 3)),
                            completion("Sure! Here they are:\n[{\"front\":\"chem Q0\",\"back\":\"chem A0\"},"
                                    + "{\"front\":\"chem Q1\",\"back\":\"chem A1\"}]\nGood luck!"));
            when(settlement.settle(eq(CREDITS), anyString(), anyMap())).thenReturn(9);

            // when
            FlashcardResponse response = service.generate("user-1", request(4));

            // then
            assertThat(response.flashcards()).hasSize(4);
            assertThat(response.flashcards()).extracting(Flashcard::front)
                    .containsExactly("bio Q0", "bio Q1", "bio Q2", "chem Q0");
            assertThat(response.flashcards()).allSatisfy(card -> assertThat(card.id()).startsWith("flashcard-"));
            assertThat(response.flashcardsBySource().get("bio.pdf")).hasSize(3);
            assertThat(response.flashcardsBySource().get("chem.pdf")).hasSize(1);
            assertThat(response.sources()).containsExactly("bio.pdf", "chem.pdf");
            assertThat(response.remainingBalance()).isEqualTo(9);
            assertThat(response.tokensUsed()).isEqualTo(102);
            verify(settlement, times(1)).settle(eq(CREDITS), anyString(), anyMap());
            verify(usage).record("user-1", KeySource.CREDITS, ProviderKind.OPENAI, "gpt-3.5-turbo",
                    UsageOperation.FLASHCARD, 100);
        }

        @Test
        @DisplayName("Should ask each source for at least three cards")
        void shouldRequestMinimumPerSource() {
            String prompt = FlashcardService.buildPrompt("bio.pdf", twoSources().subList(0, 1), 3);

            assertThat(prompt)
                    .contains("generate 3 high-quality flashcards")
                    .contains("CONTEXT FROM DOCUMENT \"bio.pdf\"")
                    .contains("[1] Cell biology");
        }

        @Test
        @DisplayName("Should report no relevant content without completing or billing")
        void shouldHandleNoRelevantContent() {
            givenRetrieval(List.of());

            FlashcardResponse response = service.generate("user-1", request(null));

            assertThat(response.noRelevantContent()).isTrue();
            assertThat(response.flashcards()).isEmpty();
            verify(orchestrator, never()).complete(any(), any(), any(), any(), any());
            verifyNoInteractions(settlement, usage);
            verify(metrics).recordRequest(KeySource.CREDITS);
        }
    }

    @Nested
    @DisplayName("Unparseable output")
    class Unparseable {

        @Test
        @DisplayName("A source whose output cannot be read is skipped")
        void shouldSkipUnparseableSource() {
            givenRetrieval(twoSources());
            when(orchestrator.complete(anyString(), eq(ProviderKind.OPENAI), isNull(), eq(SERVER), any()))
                    .thenReturn(completion("I am unable to help with that."), completion(cards("chem", 3)));

            FlashcardResponse response = service.generate("user-1", request(10));

            assertThat(response.flashcards()).extracting(Flashcard::source).containsOnly("chem.pdf");
            assertThat(response.flashcardsBySource().get("bio.pdf")).isEmpty();
            verify(settlement).settle(eq(CREDITS), anyString(), anyMap());
        }

        @Test
        @DisplayName("Fails without billing when no source yields cards")
        void shouldFailWhenAllSourcesUnparseable() {
            givenRetrieval(twoSources());
            when(orchestrator.complete(anyString(), eq(ProviderKind.OPENAI), isNull(), eq(SERVER), any()))
                    .thenReturn(completion("no json here"), completion("nor here"));

            assertThatThrownBy(() -> service.generate("user-1", request(10)))
                    .isInstanceOf(StructuredOutputException.class)
                    .hasMessageContaining("bio.pdf")
                    .hasMessageContaining("no json here");

            verifyNoInteractions(settlement);
        }
    }

    @Test
    @DisplayName("A failed completion aborts the request without billing")
    void shouldNotBillFailedCompletion() {
        givenRetrieval(twoSources());
        when(orchestrator.complete(anyString(), eq(ProviderKind.OPENAI), isNull(), eq(SERVER), any()))
                .thenReturn(completion(cards("bio", 3)))
                .thenThrow(new UpstreamProviderException("completion", "OpenAI chat HTTP 503", 503, null));

        assertThatThrownBy(() -> service.generate("user-1", request(10)))
                .isInstanceOf(UpstreamProviderException.class);

        verifyNoInteractions(settlement);
    }

    @Test
    @DisplayName("Should reject a request without sources before resolving a key")
    void shouldRejectMissingSources() {
        assertThatThrownBy(() -> service.generate("user-1", new FlashcardRequest(List.of(" "), null, null, null, 5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No source files provided");

        verifyNoInteractions(keyResolver, batcher, orchestrator);
    }
}
