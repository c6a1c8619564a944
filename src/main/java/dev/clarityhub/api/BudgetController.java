package dev.clarityhub.api;

import dev.clarityhub.budget.BudgetCheck;
import dev.clarityhub.budget.FileType;
import dev.clarityhub.budget.ProcessingBudgetGovernor;
import dev.clarityhub.budget.ProcessingEstimate;
import dev.clarityhub.budget.ProcessingUsage;
import jakarta.validation.Valid;
import org.jspecify.annotations.Nullable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST endpoints for the daily processing budget. Nothing here reserves budget. */
@RestController
@RequestMapping("/api/budget")
public class BudgetController {

  private final ProcessingBudgetGovernor governor;

  public BudgetController(ProcessingBudgetGovernor governor) {
    this.governor = governor;
  }

  /** Checks whether a batch of files fits today's remaining budget. */
  @PostMapping("/check")
  public ResponseEntity<BudgetCheck> check(
      @RequestHeader(TenantHeader.NAME) String tenantId,
      @Valid @RequestBody BudgetCheckRequest body) {
    return ResponseEntity.ok(governor.checkBudget(tenantId, body.fileCount(), body.totalBytes()));
  }

  /** Today's usage for the tenant. */
  @GetMapping("/usage")
  public ResponseEntity<ProcessingUsage> usage(
      @RequestHeader(TenantHeader.NAME) String tenantId) {
    return ResponseEntity.ok(governor.currentUsage(tenantId));
  }

  /** Previews the processing cost of one file; the size is estimated from its type if omitted. */
  @GetMapping("/estimate")
  public ResponseEntity<ProcessingEstimate> estimate(
      @RequestParam(required = false) @Nullable Long sizeBytes,
      @RequestParam(required = false) @Nullable String fileName) {
    return ResponseEntity.ok(governor.estimate(sizeBytes, FileType.fromFileName(fileName)));
  }
}
