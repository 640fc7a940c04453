package com.cloudera.datascience.vcfmerge;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import htsjdk.samtools.util.Locatable;
import java.util.List;

/**
 * One data line of a source, with its sample columns already projected onto the
 * merged samples. Records order by contig (compared as text), then position, then
 * the rank of the source they came from.
 */
public class VariantRecord implements Locatable, Comparable<VariantRecord> {
  private final String contig;
  private final int position;
  private final int sourceRank;
  private final List<String> columns;

  public VariantRecord(String contig, int position, int sourceRank, List<String> columns) {
    this.contig = contig;
    this.position = position;
    this.sourceRank = sourceRank;
    this.columns = ImmutableList.copyOf(columns);
  }

  @Override
  public String getContig() {
    return contig;
  }

  @Override
  public int getStart() {
    return position;
  }

  @Override
  public int getEnd() {
    return position;
  }

  public int getPosition() {
    return position;
  }

  public int getSourceRank() {
    return sourceRank;
  }

  /**
   * @return the output columns: the nine fixed VCF columns followed by the projected
   * sample columns
   */
  public List<String> getColumns() {
    return columns;
  }

  @Override
  public int compareTo(VariantRecord other) {
    return ComparisonChain.start()
        .compare(contig, other.contig)
        .compare(position, other.position)
        .compare(sourceRank, other.sourceRank)
        .result();
  }

  @Override
  public String toString() {
    return "VariantRecord{" +
        "contig='" + contig + '\'' +
        ", position=" + position +
        ", sourceRank=" + sourceRank +
        ", columns=" + columns +
        '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    VariantRecord that = (VariantRecord) o;

    if (position != that.position) return false;
    if (sourceRank != that.sourceRank) return false;
    if (!contig.equals(that.contig)) return false;
    return columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    int result = contig.hashCode();
    result = 31 * result + position;
    result = 31 * result + sourceRank;
    result = 31 * result + columns.hashCode();
    return result;
  }
}
