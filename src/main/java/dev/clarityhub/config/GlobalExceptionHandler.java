package dev.clarityhub.config;

import dev.clarityhub.document.DocumentNotFoundException;
import dev.clarityhub.ingestion.DocumentProcessingException;
import dev.clarityhub.search.SearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Budget rejections are not exceptions and never reach this handler; they are returned as
 * regular results with {@code allowed=false}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  ProblemDetail handleDocumentNotFound(DocumentNotFoundException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  /** Both search branches failed; the store or provider is unavailable. */
  @ExceptionHandler(SearchException.class)
  ProblemDetail handleSearchFailure(SearchException ex) {
    log.error("Search failed", ex);
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }

  @ExceptionHandler(DocumentProcessingException.class)
  ProblemDetail handleProcessingFailure(DocumentProcessingException ex) {
    log.error("Document processing failed", ex);
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, ex.getMessage());
    problem.setProperty("documentId", ex.getDocumentId());
    return problem;
  }
}
