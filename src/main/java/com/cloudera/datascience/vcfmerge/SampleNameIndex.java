package com.cloudera.datascience.vcfmerge;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A map between the sample names of one header and their column indexes.
 */
public class SampleNameIndex {

  private final List<String> sampleNames;
  private final Map<String, Integer> sampleNamesToIndexes;

  public SampleNameIndex(List<String> sampleNames) {
    this.sampleNames = sampleNames;
    this.sampleNamesToIndexes = new HashMap<>(sampleNames.size());
    for (int i = 0 ; i < sampleNames.size(); i++) {
      sampleNamesToIndexes.put(sampleNames.get(i), i);
    }
  }

  public boolean contains(String sampleName) {
    return sampleNamesToIndexes.containsKey(sampleName);
  }

  public int getSampleIndex(String sampleName) {
    Integer index = sampleNamesToIndexes.get(sampleName);
    if (index == null) {
      throw new IllegalStateException("Sample " + sampleName + " not in " + sampleNames);
    }
    return index;
  }
}
