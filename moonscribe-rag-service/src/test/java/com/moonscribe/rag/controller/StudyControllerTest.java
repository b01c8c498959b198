package com.moonscribe.rag.controller;

import com.moonscribe.rag.dto.Flashcard;
import com.moonscribe.rag.dto.FlashcardResponse;
import com.moonscribe.rag.exception.StructuredOutputException;
import com.moonscribe.rag.service.FlashcardService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for StudyController.
 */
@WebMvcTest(StudyController.class)
class StudyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FlashcardService flashcardService;

    @Test
    @DisplayName("Should return flashcards grouped by source")
    void shouldReturnFlashcards() throws Exception {
        // Given
        Flashcard card = new Flashcard("flashcard-1-0", "What is ATP?", "The energy currency of the cell", "bio.pdf");
        when(flashcardService.generate(eq("user-1"), any())).thenReturn(new FlashcardResponse(
                List.of(card), List.of("bio.pdf"), Map.of("bio.pdf", List.of(card)), "team", "Biology Lab", null, 80, false));

        // When/Then
        mockMvc.perform(post("/api/study/flashcards")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "sourceFilenames": ["bio.pdf"],
                                    "count": 5
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.flashcards[0].front").value("What is ATP?"))
                .andExpect(jsonPath("$.flashcardsBySource['bio.pdf'][0].id").value("flashcard-1-0"))
                .andExpect(jsonPath("$.keySource").value("team"))
                .andExpect(jsonPath("$.teamName").value("Biology Lab"));
    }

    @Test
    @DisplayName("Should return 400 when no sources are given")
    void shouldRejectMissingSources() throws Exception {
        when(flashcardService.generate(any(), any())).thenThrow(new IllegalArgumentException("No source files provided"));

        mockMvc.perform(post("/api/study/flashcards")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceFilenames\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation error: No source files provided"));
    }

    @Test
    @DisplayName("Should return 502 with the parse stage for unreadable model output")
    void shouldReturnBadGatewayOnParseFailure() throws Exception {
        when(flashcardService.generate(any(), any()))
                .thenThrow(new StructuredOutputException("Could not parse flashcards.", "I cannot"));

        mockMvc.perform(post("/api/study/flashcards")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceFilenames\": [\"bio.pdf\"]}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.stage").value("parse"));
    }
}
