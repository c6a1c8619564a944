package dev.clarityhub.search;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link SearchAnalyticsEntry} rows. */
public interface SearchAnalyticsRepository extends JpaRepository<SearchAnalyticsEntry, UUID> {}
