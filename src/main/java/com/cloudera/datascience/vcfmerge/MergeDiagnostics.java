package com.cloudera.datascience.vcfmerge;

/**
 * Receives the non-fatal observations made during a merge. Nothing reported here
 * changes the merged output.
 */
public interface MergeDiagnostics {

  /**
   * Two sources define the same ID differently.
   * @param category the kind of definition line
   * @param id the definition ID
   * @param discardedLine the definition that was dropped
   * @param keptLine the definition written to the merged header
   */
  void headerConflict(DefinitionCategory category, String id, String discardedLine,
      String keptLine);

  /**
   * A source has been read to the end with uninformative records being removed.
   * @param sourceName the source
   * @param skipped the number of records dropped
   * @param total the number of data records read
   */
  void recordsSkipped(String sourceName, long skipped, long total);
}
