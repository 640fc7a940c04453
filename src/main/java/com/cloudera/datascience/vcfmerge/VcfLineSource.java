package com.cloudera.datascience.vcfmerge;

import htsjdk.samtools.util.CloseableIterator;

/**
 * A source of decoded VCF text lines that can be opened more than once. The header
 * and the records of a source are read through separate openings, so that the
 * header can be combined before any record is read.
 */
public interface VcfLineSource {

  /**
   * @return a name for the source, used in diagnostics and error messages
   */
  String getName();

  /**
   * Open the source from its first line. Line terminators are not included in the
   * returned lines. Callers must close the iterator.
   * @return an iterator over the lines of the source
   */
  CloseableIterator<String> openLines();
}
