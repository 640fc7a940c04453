package com.cloudera.datascience.vcfmerge;

import com.google.common.collect.ImmutableList;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.Log;
import java.io.File;
import java.io.IOException;
import java.io.Writer;

/**
 * Merges two VCF sources that share some or all of their samples, for example a VCF
 * of structural variants and one of small variants called on the same samples.
 * <p>
 * Only the samples of the first source that are also in the second are kept. If both
 * sources are sorted with the same contig ordering then the output is sorted too, so
 * it is usually best to sort the smaller source to match the larger one.
 */
public class VcfMerge {

  private static final Log log = Log.getInstance(VcfMerge.class);

  /**
   * Merge two VCF files, reporting diagnostics to the log.
   * @param first the first VCF file, which wins ties at the same position
   * @param second the second VCF file
   * @param removeRef if true, drop records where every shared sample is hom-ref or
   *                  a no-call
   * @param out where to write the merged VCF
   */
  public static void merge(File first, File second, boolean removeRef, Writer out)
      throws IOException {
    merge(new FileVcfLineSource(first), new FileVcfLineSource(second), removeRef, out,
        new LoggingMergeDiagnostics());
  }

  /**
   * Merge two VCF sources.
   * @param first the first source, which wins ties at the same position and whose
   *              sample order is kept
   * @param second the second source
   * @param removeRef if true, drop records where every shared sample is hom-ref or
   *                  a no-call
   * @param out where to write the merged VCF
   * @param diagnostics receives header conflicts and skipped record counts
   */
  public static void merge(VcfLineSource first, VcfLineSource second, boolean removeRef,
      Writer out, MergeDiagnostics diagnostics) throws IOException {
    VcfHeader firstHeader = VcfHeaderExtractor.extract(first);
    VcfHeader secondHeader = VcfHeaderExtractor.extract(second);
    CombinedHeader combinedHeader =
        new VcfHeaderCombiner(diagnostics).combine(firstHeader, secondHeader);
    log.info(String.format("merging %d of %d samples from %s with %d samples from %s",
        combinedHeader.getHeader().getNumSamples(), firstHeader.getNumSamples(),
        first.getName(), secondHeader.getNumSamples(), second.getName()));

    VcfTextWriter writer = new VcfTextWriter(out);
    writer.writeHeader(combinedHeader.getHeader());

    VariantRecordIterator firstRecords = null;
    VariantRecordIterator secondRecords = null;
    try {
      firstRecords = new VariantRecordIterator(first.openLines(), first.getName(),
          firstHeader, combinedHeader.getFirstProjection(), 0, removeRef, diagnostics);
      secondRecords = new VariantRecordIterator(second.openLines(), second.getName(),
          secondHeader, combinedHeader.getSecondProjection(), 1, removeRef, diagnostics);
      CoordinateMergingIterator merged =
          new CoordinateMergingIterator(ImmutableList.of(firstRecords, secondRecords));
      long written = 0;
      while (merged.hasNext()) {
        writer.writeRecord(merged.next());
        written++;
      }
      writer.flush();
      log.debug("read ", firstRecords.getTotal(), " records from ", first.getName());
      log.debug("read ", secondRecords.getTotal(), " records from ", second.getName());
      log.debug("wrote ", written, " records");
    } finally {
      CloserUtil.close(firstRecords);
      CloserUtil.close(secondRecords);
    }
  }
}
