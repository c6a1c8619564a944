package dev.clarityhub.ingestion.chunking;

import java.util.List;
import java.util.Objects;

/**
 * Optional provenance tables for {@link HierarchicalChunker#chunk(String, ChunkingOptions)}.
 *
 * @param pageBreaks ascending character offsets at which a new page starts
 * @param sectionHeadings headings with the ascending offsets at which they take effect
 */
public record ChunkingOptions(List<Integer> pageBreaks, List<SectionHeading> sectionHeadings) {

  /** Options carrying no page or section information. */
  public static final ChunkingOptions NONE = new ChunkingOptions(List.of(), List.of());

  /**
   * A section heading and the document offset where it starts.
   *
   * @param heading the heading text
   * @param offset character offset of the heading in the document
   */
  public record SectionHeading(String heading, int offset) {
    public SectionHeading {
      Objects.requireNonNull(heading, "heading must not be null");
    }
  }

  public ChunkingOptions {
    pageBreaks = pageBreaks == null ? List.of() : List.copyOf(pageBreaks);
    sectionHeadings = sectionHeadings == null ? List.of() : List.copyOf(sectionHeadings);
    for (int i = 1; i < pageBreaks.size(); i++) {
      if (pageBreaks.get(i) < pageBreaks.get(i - 1)) {
        throw new IllegalArgumentException("pageBreaks must be in ascending order");
      }
    }
    for (int i = 1; i < sectionHeadings.size(); i++) {
      if (sectionHeadings.get(i).offset() < sectionHeadings.get(i - 1).offset()) {
        throw new IllegalArgumentException("sectionHeadings must be in ascending offset order");
      }
    }
  }
}
