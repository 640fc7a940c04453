package com.cloudera.datascience.vcfmerge;

import java.util.ArrayList;
import java.util.List;

class RecordingMergeDiagnostics implements MergeDiagnostics {
  final List<String> conflicts = new ArrayList<>();
  final List<String> skips = new ArrayList<>();

  @Override
  public void headerConflict(DefinitionCategory category, String id,
      String discardedLine, String keptLine) {
    conflicts.add(category + ":" + id + ":" + keptLine);
  }

  @Override
  public void recordsSkipped(String sourceName, long skipped, long total) {
    skips.add(sourceName + ":" + skipped + "/" + total);
  }
}
