package dev.clarityhub.ingestion;

import dev.clarityhub.budget.BudgetCheck;
import dev.clarityhub.document.ProcessingStatus;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link DocumentProcessingService#process}.
 *
 * @param documentId the processed document
 * @param accepted false when the daily budget rejected the work; nothing was processed then
 * @param status the document's status afterwards
 * @param chunksCreated parent and child chunks stored
 * @param summary the document summary, null when rejected
 * @param budget the budget decision, with the reason when rejected
 */
public record ProcessingResult(
        UUID documentId,
        boolean accepted,
        ProcessingStatus status,
        int chunksCreated,
        @Nullable String summary,
        BudgetCheck budget) {

    static ProcessingResult completed(UUID documentId, int chunksCreated, String summary, BudgetCheck budget) {
        return new ProcessingResult(documentId, true, ProcessingStatus.COMPLETED, chunksCreated, summary, budget);
    }

    static ProcessingResult rejected(UUID documentId, ProcessingStatus status, BudgetCheck budget) {
        return new ProcessingResult(documentId, false, status, 0, null, budget);
    }
}
