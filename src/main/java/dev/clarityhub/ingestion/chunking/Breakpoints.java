package dev.clarityhub.ingestion.chunking;

import dev.clarityhub.ingestion.chunking.ChunkingOptions.SectionHeading;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Offset lookups against ordered breakpoint tables. Tables are small, so a linear scan is used.
 */
final class Breakpoints {

  private Breakpoints() {}

  /**
   * Returns the 1-based page containing {@code offset}: one plus the number of page breaks at or
   * before it.
   *
   * @return the page number, or null when there are no page breaks
   */
  static @Nullable Integer pageAt(int offset, List<Integer> pageBreaks) {
    if (pageBreaks.isEmpty()) {
      return null;
    }
    int page = 1;
    for (int breakOffset : pageBreaks) {
      if (offset >= breakOffset) {
        page++;
      } else {
        break;
      }
    }
    return page;
  }

  /**
   * Returns the heading of the last section starting at or before {@code offset}.
   *
   * @return the heading, or null when the offset precedes every section
   */
  static @Nullable String sectionAt(int offset, List<SectionHeading> sections) {
    String heading = null;
    for (SectionHeading section : sections) {
      if (offset >= section.offset()) {
        heading = section.heading();
      } else {
        break;
      }
    }
    return heading;
  }
}
