package dev.clarityhub.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.clarityhub.budget.BudgetCheck;
import dev.clarityhub.budget.ProcessingUsage;
import dev.clarityhub.config.GlobalExceptionHandler;
import dev.clarityhub.document.Document;
import dev.clarityhub.document.DocumentNotFoundException;
import dev.clarityhub.document.ProcessingStatus;
import dev.clarityhub.fixture.DocumentBuilder;
import dev.clarityhub.ingestion.DocumentProcessingException;
import dev.clarityhub.ingestion.DocumentProcessingService;
import dev.clarityhub.ingestion.ProcessDocumentRequest;
import dev.clarityhub.ingestion.ProcessingResult;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class DocumentControllerTest {

  @Mock DocumentProcessingService processingService;

  @Captor ArgumentCaptor<ProcessDocumentRequest> requestCaptor;

  MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new DocumentController(processingService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void registerReturnsCreatedDocumentWithoutText() throws Exception {
    Document document = new DocumentBuilder().name("deed.docx").documentType("deed").build();
    given(processingService.register("tenant-a", "deed.docx", "deed", 4096L)).willReturn(document);

    mockMvc
        .perform(
            post("/api/documents")
                .header("X-Tenant-Id", "tenant-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"name\": \"deed.docx\", \"documentType\": \"deed\", \"sizeBytes\": 4096}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(document.getId().toString()))
        .andExpect(jsonPath("$.processingStatus").value("PENDING"))
        .andExpect(jsonPath("$.extractedText").doesNotExist());
  }

  @Test
  void registerWithoutNameIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/documents")
                .header("X-Tenant-Id", "tenant-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documentType\": \"deed\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void processPassesTranscriptThrough() throws Exception {
    UUID documentId = UUID.randomUUID();
    given(processingService.process(eq("tenant-a"), eq(documentId), any()))
        .willReturn(
            new ProcessingResult(
                documentId,
                true,
                ProcessingStatus.COMPLETED,
                1,
                "A hearing.",
                new BudgetCheck(
                    true,
                    null,
                    9,
                    1000L,
                    new ProcessingUsage("tenant-a", LocalDate.of(2026, 3, 2), 1, 10L))));

    mockMvc
        .perform(
            post("/api/documents/{id}/process", documentId)
                .header("X-Tenant-Id", "tenant-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"transcript": [{"text": "Court is in session.", "start": 0.0, "end": 2.5}]}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accepted").value(true))
        .andExpect(jsonPath("$.chunksCreated").value(1));

    verify(processingService).process(eq("tenant-a"), eq(documentId), requestCaptor.capture());
    assertThat(requestCaptor.getValue().isTranscript()).isTrue();
    assertThat(requestCaptor.getValue().fullText()).isEqualTo("Court is in session.");
  }

  @Test
  void processingFailureIsBadGateway() throws Exception {
    UUID documentId = UUID.randomUUID();
    given(processingService.process(eq("tenant-a"), eq(documentId), any()))
        .willThrow(
            new DocumentProcessingException(
                documentId, "provider down", new IllegalStateException("provider down")));

    mockMvc
        .perform(
            post("/api/documents/{id}/process", documentId)
                .header("X-Tenant-Id", "tenant-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"Clause one.\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.documentId").value(documentId.toString()));
  }

  @Test
  void unknownDocumentIsNotFound() throws Exception {
    UUID documentId = UUID.randomUUID();
    given(processingService.getDocument("tenant-a", documentId))
        .willThrow(new DocumentNotFoundException(documentId));

    mockMvc
        .perform(get("/api/documents/{id}", documentId).header("X-Tenant-Id", "tenant-a"))
        .andExpect(status().isNotFound());
  }
}
