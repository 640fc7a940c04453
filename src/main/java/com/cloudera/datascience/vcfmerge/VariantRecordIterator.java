package com.cloudera.datascience.vcfmerge;

import com.google.common.base.Splitter;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableSet;
import htsjdk.samtools.util.CloseableIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang.StringUtils;

/**
 * Lazily reads the data records of one source. Sample columns are projected onto
 * the merged samples, and if requested, records where every merged sample is
 * hom-ref or a no-call are dropped.
 */
public class VariantRecordIterator extends AbstractIterator<VariantRecord>
    implements CloseableIterator<VariantRecord> {

  static final Set<String> UNINFORMATIVE_GENOTYPES =
      ImmutableSet.of(".", "./.", "0/0", ".|.", "0|0");

  private static final Splitter TAB = Splitter.on('\t');
  private static final int REF_COLUMN = 3;
  private static final int ALT_COLUMN = 4;
  private static final int FIXED_COLUMNS = 9;
  private static final int SITES_ONLY_COLUMNS = 8;

  private final CloseableIterator<String> lines;
  private final String sourceName;
  private final int numSourceSamples;
  private final SampleProjection projection;
  private final int sourceRank;
  private final boolean removeUninformative;
  private final MergeDiagnostics diagnostics;

  private long total;
  private long skipped;
  private boolean closed;

  public VariantRecordIterator(CloseableIterator<String> lines, String sourceName,
      VcfHeader sourceHeader, SampleProjection projection, int sourceRank,
      boolean removeUninformative, MergeDiagnostics diagnostics) {
    this.lines = lines;
    this.sourceName = sourceName;
    this.numSourceSamples = sourceHeader.getNumSamples();
    this.projection = projection;
    this.sourceRank = sourceRank;
    this.removeUninformative = removeUninformative;
    this.diagnostics = diagnostics;
  }

  @Override
  protected VariantRecord computeNext() {
    while (lines.hasNext()) {
      String line = lines.next();
      if (line.startsWith("#") || line.trim().isEmpty()) {
        continue;
      }
      total++;
      List<String> columns = TAB.splitToList(StringUtils.stripEnd(line, null));
      int minColumns = numSourceSamples > 0 ? FIXED_COLUMNS + numSourceSamples :
          SITES_ONLY_COLUMNS;
      if (columns.size() < minColumns) {
        throw new MalformedVcfException(sourceName, String.format(
            "expected at least %d columns but found %d: %s", minColumns,
            columns.size(), line));
      }

      List<String> samples = projection.apply(
          columns.subList(Math.min(FIXED_COLUMNS, columns.size()), columns.size()));
      if (removeUninformative && allUninformative(samples)) {
        skipped++;
        continue;
      }

      List<String> outputColumns =
          new ArrayList<>(columns.subList(0, Math.min(FIXED_COLUMNS, columns.size())));
      outputColumns.addAll(samples);
      // symbolic alleles with an N reference base, as written by some SV callers
      if (outputColumns.get(REF_COLUMN).equals("N") &&
          outputColumns.get(ALT_COLUMN).startsWith("<")) {
        outputColumns.set(REF_COLUMN, ".");
      }
      return new VariantRecord(columns.get(0), parsePosition(columns.get(1), line),
          sourceRank, outputColumns);
    }
    if (removeUninformative) {
      diagnostics.recordsSkipped(sourceName, skipped, total);
    }
    close();
    return endOfData();
  }

  /**
   * @return true if the leading genotype of every sample is hom-ref or a no-call;
   * vacuously true if there are no samples
   */
  static boolean allUninformative(List<String> samples) {
    for (String sample : samples) {
      if (!UNINFORMATIVE_GENOTYPES.contains(StringUtils.substringBefore(sample, ":"))) {
        return false;
      }
    }
    return true;
  }

  private int parsePosition(String position, String line) {
    try {
      return Integer.parseInt(position);
    } catch (NumberFormatException e) {
      throw new MalformedVcfException(sourceName, "invalid position: " + line, e);
    }
  }

  public long getTotal() {
    return total;
  }

  public long getSkipped() {
    return skipped;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      lines.close();
    }
  }
}
