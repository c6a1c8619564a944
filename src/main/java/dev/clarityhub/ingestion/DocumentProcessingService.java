package dev.clarityhub.ingestion;

import dev.clarityhub.budget.BudgetCheck;
import dev.clarityhub.budget.FileType;
import dev.clarityhub.budget.ProcessingBudgetGovernor;
import dev.clarityhub.document.Document;
import dev.clarityhub.document.DocumentNotFoundException;
import dev.clarityhub.document.DocumentRepository;
import dev.clarityhub.ingestion.chunking.Chunk;
import dev.clarityhub.ingestion.chunking.HierarchicalChunker;
import dev.clarityhub.ingestion.embedding.BatchEmbedder;
import dev.clarityhub.ingestion.embedding.EmbeddingBatchResult;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Orchestrates document processing: budget -> chunk -> summarise -> embed -> store.
 *
 * <p>The daily budget is reserved first; a rejection is returned as a result and leaves the
 * document untouched. Accepted documents are marked {@code PROCESSING}, chunked (text or
 * transcript), summarised and embedded. Only once every embedding exists are the document's
 * previous chunks removed and the new ones added, so a provider failure never leaves a document
 * half re-indexed.
 *
 * <p><strong>Transaction semantics:</strong> the store calls are not wrapped in a database
 * transaction. Embedding calls are external API operations that cannot take part in one, and the
 * delete-then-insert window is short. A failure marks the document {@code FAILED} and is rethrown
 * as {@link DocumentProcessingException}; the reserved budget is not refunded.
 */
@Service
public class DocumentProcessingService {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessingService.class);

    static final String NO_TEXT_SUMMARY = "No extractable text content found.";
    static final int MAX_STORED_TEXT_CHARS = 50_000;

    private final DocumentRepository documentRepository;
    private final ProcessingBudgetGovernor budgetGovernor;
    private final HierarchicalChunker chunker;
    private final DocumentSummarizer summarizer;
    private final BatchEmbedder batchEmbedder;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final Clock clock;

    public DocumentProcessingService(DocumentRepository documentRepository,
                                     ProcessingBudgetGovernor budgetGovernor,
                                     HierarchicalChunker chunker,
                                     DocumentSummarizer summarizer,
                                     BatchEmbedder batchEmbedder,
                                     EmbeddingStore<TextSegment> embeddingStore,
                                     Clock clock) {
        this.documentRepository = documentRepository;
        this.budgetGovernor = budgetGovernor;
        this.chunker = chunker;
        this.summarizer = summarizer;
        this.batchEmbedder = batchEmbedder;
        this.embeddingStore = embeddingStore;
        this.clock = clock;
    }

    /**
     * Registers a document so it can be processed.
     *
     * @param tenantId     owning tenant
     * @param name         file name, also used to detect the file type
     * @param documentType document category used by search filters
     * @param sizeBytes    file size, or null when unknown
     * @return the saved document in {@code PENDING} state
     */
    public Document register(String tenantId, String name, String documentType, @Nullable Long sizeBytes) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (documentType == null || documentType.isBlank()) {
            throw new IllegalArgumentException("documentType must not be blank");
        }
        if (sizeBytes != null && sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must not be negative");
        }
        Document saved = documentRepository.save(
                new Document(tenantId, name.strip(), documentType.strip(), sizeBytes, clock.instant()));
        log.debug("Registered document {} ({}) for tenant {}", saved.getId(), name, tenantId);
        return saved;
    }

    /**
     * Loads a tenant's document.
     *
     * @throws DocumentNotFoundException if it does not exist for this tenant
     */
    public Document getDocument(String tenantId, UUID documentId) {
        return documentRepository.findByIdAndTenantId(documentId, tenantId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    /**
     * Processes extracted content for a registered document, replacing any chunks from an earlier
     * run.
     *
     * @param tenantId   owning tenant
     * @param documentId the registered document
     * @param request    extracted text or transcript
     * @return the outcome; {@code accepted=false} when the daily budget is exhausted
     * @throws DocumentNotFoundException  if the document does not exist for this tenant
     * @throws DocumentProcessingException if chunking, embedding or storing fails
     */
    public ProcessingResult process(String tenantId, UUID documentId, ProcessDocumentRequest request) {
        Document document = getDocument(tenantId, documentId);
        FileType fileType = FileType.fromFileName(document.getName());

        BudgetCheck budget = budgetGovernor.reserve(tenantId, 1, fileType.billableBytes(document.getSizeBytes()));
        if (!budget.allowed()) {
            log.info("Processing of {} rejected: {}", documentId, budget.reason());
            return ProcessingResult.rejected(documentId, document.getProcessingStatus(), budget);
        }

        document.markProcessing();
        documentRepository.save(document);

        try {
            String text = request.fullText();
            if (text.isBlank()) {
                removeChunks(documentId);
                document.markCompleted(NO_TEXT_SUMMARY, "", 0, clock.instant());
                documentRepository.save(document);
                log.info("Document {} has no extractable text", documentId);
                return ProcessingResult.completed(documentId, 0, NO_TEXT_SUMMARY, budget);
            }

            List<Chunk> chunks = request.isTranscript()
                    ? chunker.chunkTranscript(request.transcript())
                    : chunker.chunk(text, request.chunkingOptions());
            String summary = summarizer.summarize(text, document.getName());
            EmbeddingBatchResult embeddings = batchEmbedder.embedBatchWithReport(
                    chunks.stream().map(Chunk::content).toList());

            int stored = replaceChunks(document, fileType, chunks, embeddings);

            String storedText = text.length() > MAX_STORED_TEXT_CHARS
                    ? text.substring(0, MAX_STORED_TEXT_CHARS)
                    : text;
            document.markCompleted(summary, storedText, stored, clock.instant());
            documentRepository.save(document);
            log.info("Processed document {}: {} chunks stored ({} truncated for embedding)",
                    documentId, stored, embeddings.truncatedPositions().size());
            return ProcessingResult.completed(documentId, stored, summary, budget);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Processing of document {} failed: {}", documentId, message, e);
            document.markFailed(message, clock.instant());
            documentRepository.save(document);
            throw new DocumentProcessingException(documentId, message, e);
        }
    }

    private int replaceChunks(Document document, FileType fileType, List<Chunk> chunks,
                              EmbeddingBatchResult embeddings) {
        List<Embedding> vectors = new ArrayList<>();
        List<TextSegment> segments = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            if (embeddings.isEmpty(i)) {
                continue;
            }
            Metadata metadata = chunks.get(i).toMetadata()
                    .put("document_id", document.getId().toString())
                    .put("tenant_id", document.getTenantId())
                    .put("document_type", document.getDocumentType())
                    .put("source_file_name", document.getName())
                    .put("source_file_type", fileType.name().toLowerCase(Locale.ROOT));
            if (embeddings.isTruncated(i)) {
                metadata.put("truncated_for_embedding", "true");
            }
            segments.add(TextSegment.from(chunks.get(i).content(), metadata));
            vectors.add(embeddings.embeddings().get(i));
        }

        removeChunks(document.getId());
        if (!segments.isEmpty()) {
            embeddingStore.addAll(vectors, segments);
        }
        return segments.size();
    }

    private void removeChunks(UUID documentId) {
        embeddingStore.removeAll(metadataKey("document_id").isEqualTo(documentId.toString()));
    }
}
