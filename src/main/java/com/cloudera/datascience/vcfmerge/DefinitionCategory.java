package com.cloudera.datascience.vcfmerge;

/**
 * The kinds of structured, <code>ID</code>-keyed metadata lines. Declaration order is
 * the order the categories are combined and written out in.
 */
public enum DefinitionCategory {
  FORMAT("##FORMAT"),
  INFO("##INFO"),
  CONTIG("##contig"),
  FILTER("##FILTER");

  private final String linePrefix;

  DefinitionCategory(String linePrefix) {
    this.linePrefix = linePrefix;
  }

  /**
   * @return the category of the given metadata line, or null if the line is not a
   * definition line
   */
  public static DefinitionCategory forLine(String line) {
    for (DefinitionCategory category : values()) {
      if (line.startsWith(category.linePrefix)) {
        return category;
      }
    }
    return null;
  }
}
