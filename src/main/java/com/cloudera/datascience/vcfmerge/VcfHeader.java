package com.cloudera.datascience.vcfmerge;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The metadata block of a VCF source: definition lines keyed by their
 * <code>ID</code> (in file order), the remaining metadata lines, and the sample
 * names from the column header line.
 */
public class VcfHeader {

  public static final String FILE_FORMAT_LINE = "##fileformat=VCFv4.1";
  public static final String COLUMN_HEADER_PREFIX = "#CHROM\t";
  public static final List<String> FIXED_COLUMNS = ImmutableList.of(
      "#CHROM", "POS", "ID", "REF", "ALT", "QUAL", "FILTER", "INFO", "FORMAT");

  private final Map<DefinitionCategory, ImmutableMap<String, String>> definitions;
  private final List<String> otherLines;
  private final List<String> sampleNames;

  public VcfHeader(Map<DefinitionCategory, ? extends Map<String, String>> definitions,
      List<String> otherLines, List<String> sampleNames) {
    this.definitions = new EnumMap<>(DefinitionCategory.class);
    for (DefinitionCategory category : DefinitionCategory.values()) {
      Map<String, String> lines = definitions.get(category);
      this.definitions.put(category,
          lines == null ? ImmutableMap.of() : ImmutableMap.copyOf(lines));
    }
    this.otherLines = ImmutableList.copyOf(otherLines);
    this.sampleNames = ImmutableList.copyOf(sampleNames);
  }

  /**
   * @return the definition lines of the given category, keyed by ID, in insertion
   * order
   */
  public Map<String, String> getDefinitions(DefinitionCategory category) {
    return definitions.get(category);
  }

  public Map<String, String> getFormats() {
    return getDefinitions(DefinitionCategory.FORMAT);
  }

  public Map<String, String> getInfos() {
    return getDefinitions(DefinitionCategory.INFO);
  }

  public Map<String, String> getContigs() {
    return getDefinitions(DefinitionCategory.CONTIG);
  }

  public Map<String, String> getFilters() {
    return getDefinitions(DefinitionCategory.FILTER);
  }

  public List<String> getOtherLines() {
    return otherLines;
  }

  public List<String> getSampleNames() {
    return sampleNames;
  }

  public int getNumSamples() {
    return sampleNames.size();
  }

  @Override
  public String toString() {
    return "VcfHeader{" +
        "definitions=" + definitions +
        ", otherLines=" + otherLines +
        ", sampleNames=" + sampleNames +
        '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    VcfHeader that = (VcfHeader) o;

    if (!definitions.equals(that.definitions)) return false;
    if (!otherLines.equals(that.otherLines)) return false;
    return sampleNames.equals(that.sampleNames);
  }

  @Override
  public int hashCode() {
    int result = definitions.hashCode();
    result = 31 * result + otherLines.hashCode();
    result = 31 * result + sampleNames.hashCode();
    return result;
  }
}
