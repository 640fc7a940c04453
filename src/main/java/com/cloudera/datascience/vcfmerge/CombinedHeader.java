package com.cloudera.datascience.vcfmerge;

/**
 * The result of combining two headers: the merged header, and the projection that
 * maps each source's sample columns onto the merged samples.
 */
public class CombinedHeader {
  private final VcfHeader header;
  private final SampleProjection firstProjection;
  private final SampleProjection secondProjection;

  public CombinedHeader(VcfHeader header, SampleProjection firstProjection,
      SampleProjection secondProjection) {
    this.header = header;
    this.firstProjection = firstProjection;
    this.secondProjection = secondProjection;
  }

  public VcfHeader getHeader() {
    return header;
  }

  public SampleProjection getFirstProjection() {
    return firstProjection;
  }

  public SampleProjection getSecondProjection() {
    return secondProjection;
  }
}
