package com.cloudera.datascience.vcfmerge;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines the headers of two sources. The merged header keeps the samples of the
 * first source that also appear in the second (in the first source's order), takes
 * the union of the definition lines, and appends the second source's other metadata
 * lines that the first does not already have.
 */
public class VcfHeaderCombiner {

  private static final String FLOAT_TYPE = "=Float";

  private final MergeDiagnostics diagnostics;

  public VcfHeaderCombiner(MergeDiagnostics diagnostics) {
    this.diagnostics = diagnostics;
  }

  public CombinedHeader combine(VcfHeader first, VcfHeader second) {
    SampleNameIndex firstSamples = new SampleNameIndex(first.getSampleNames());
    SampleNameIndex secondSamples = new SampleNameIndex(second.getSampleNames());
    List<String> sampleNames = new ArrayList<>();
    for (String sampleName : first.getSampleNames()) {
      if (secondSamples.contains(sampleName)) {
        sampleNames.add(sampleName);
      }
    }

    Map<DefinitionCategory, Map<String, String>> definitions =
        new EnumMap<>(DefinitionCategory.class);
    for (DefinitionCategory category : DefinitionCategory.values()) {
      definitions.put(category, combineDefinitions(category,
          first.getDefinitions(category), second.getDefinitions(category)));
    }

    List<String> otherLines = new ArrayList<>(first.getOtherLines());
    Set<String> seen = new HashSet<>(otherLines);
    for (String line : second.getOtherLines()) {
      if (seen.add(line)) {
        otherLines.add(line);
      }
    }

    VcfHeader header = new VcfHeader(definitions, otherLines, sampleNames);
    return new CombinedHeader(header,
        SampleProjection.of(firstSamples, sampleNames),
        SampleProjection.of(secondSamples, sampleNames));
  }

  private Map<String, String> combineDefinitions(DefinitionCategory category,
      Map<String, String> first, Map<String, String> second) {
    Map<String, String> combined = new LinkedHashMap<>(first);
    for (Map.Entry<String, String> entry : second.entrySet()) {
      String id = entry.getKey();
      String line = entry.getValue();
      String existing = combined.get(id);
      if (existing == null) {
        combined.put(id, line);
      } else if (!existing.equals(line)) {
        // prefer the wider numeric type
        if (line.contains(FLOAT_TYPE) && !existing.contains(FLOAT_TYPE)) {
          diagnostics.headerConflict(category, id, existing, line);
          combined.put(id, line);
        } else {
          diagnostics.headerConflict(category, id, line, existing);
        }
      }
    }
    return combined;
  }
}
