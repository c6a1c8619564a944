package dev.clarityhub.api;

import dev.clarityhub.document.Document;
import dev.clarityhub.ingestion.DocumentProcessingService;
import dev.clarityhub.ingestion.ProcessDocumentRequest;
import dev.clarityhub.ingestion.ProcessingResult;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for registering documents and processing their extracted content.
 *
 * <p>A budget rejection is a normal {@code 200} response with {@code accepted=false} and the
 * reason in {@code budget.reason}.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

  private final DocumentProcessingService processingService;

  public DocumentController(DocumentProcessingService processingService) {
    this.processingService = processingService;
  }

  /** Registers a document for later processing. */
  @PostMapping
  public ResponseEntity<DocumentResponse> register(
      @RequestHeader(TenantHeader.NAME) String tenantId,
      @Valid @RequestBody RegisterDocumentRequest body) {
    Document document =
        processingService.register(tenantId, body.name(), body.documentType(), body.sizeBytes());
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Gets a document and its processing status. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> get(
      @RequestHeader(TenantHeader.NAME) String tenantId, @PathVariable UUID documentId) {
    return ResponseEntity.ok(
        DocumentResponse.fromEntity(processingService.getDocument(tenantId, documentId)));
  }

  /** Chunks, summarises and embeds a document's extracted text or transcript. */
  @PostMapping("/{documentId}/process")
  public ResponseEntity<ProcessingResult> process(
      @RequestHeader(TenantHeader.NAME) String tenantId,
      @PathVariable UUID documentId,
      @RequestBody ProcessDocumentRequest body) {
    return ResponseEntity.ok(processingService.process(tenantId, documentId, body));
  }
}
