package com.cloudera.datascience.vcfmerge;

import htsjdk.samtools.util.Log;

/**
 * Reports merge diagnostics through the htsjdk log.
 */
public class LoggingMergeDiagnostics implements MergeDiagnostics {

  private static final Log log = Log.getInstance(LoggingMergeDiagnostics.class);

  @Override
  public void headerConflict(DefinitionCategory category, String id,
      String discardedLine, String keptLine) {
    log.warn(String.format("differing %s headers for %s: %s vs (using) %s",
        category, id, discardedLine, keptLine));
  }

  @Override
  public void recordsSkipped(String sourceName, long skipped, long total) {
    log.info(String.format("skipped %d ref/unknown variants out of %d from %s",
        skipped, total, sourceName));
  }
}
