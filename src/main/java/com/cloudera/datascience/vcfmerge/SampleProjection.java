package com.cloudera.datascience.vcfmerge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Selects and reorders the sample columns of one source so that they line up with
 * the merged sample list. Entry <code>i</code> is the source's sample column index
 * for merged sample <code>i</code>.
 */
public class SampleProjection {

  private final int[] sourceIndexes;

  public SampleProjection(int[] sourceIndexes) {
    this.sourceIndexes = sourceIndexes.clone();
  }

  /**
   * Build the projection of a source onto a list of merged sample names, all of which
   * must be present in the source.
   * @param sourceSamples the source's sample names
   * @param mergedSampleNames the merged sample names
   * @return the projection
   * @throws IllegalStateException if a merged sample is not in the source
   */
  public static SampleProjection of(SampleNameIndex sourceSamples,
      List<String> mergedSampleNames) {
    int[] indexes = new int[mergedSampleNames.size()];
    for (int i = 0; i < indexes.length; i++) {
      indexes[i] = sourceSamples.getSampleIndex(mergedSampleNames.get(i));
    }
    return new SampleProjection(indexes);
  }

  public int size() {
    return sourceIndexes.length;
  }

  public int getSourceIndex(int mergedIndex) {
    return sourceIndexes[mergedIndex];
  }

  /**
   * @param sampleColumns the sample columns of a source record, in source order
   * @return the selected columns, in merged order
   */
  public List<String> apply(List<String> sampleColumns) {
    List<String> projected = new ArrayList<>(sourceIndexes.length);
    for (int sourceIndex : sourceIndexes) {
      projected.add(sampleColumns.get(sourceIndex));
    }
    return projected;
  }

  @Override
  public String toString() {
    return "SampleProjection" + Arrays.toString(sourceIndexes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(sourceIndexes, ((SampleProjection) o).sourceIndexes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(sourceIndexes);
  }
}
