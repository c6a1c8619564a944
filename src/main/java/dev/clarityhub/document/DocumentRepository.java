package dev.clarityhub.document;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Document} entities. */
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  Optional<Document> findByIdAndTenantId(UUID id, String tenantId);
}
