package com.cloudera.datascience.vcfmerge;

import com.google.common.base.Splitter;
import htsjdk.samtools.util.CloseableIterator;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang.StringUtils;

/**
 * Parses the metadata block at the start of a VCF source into a {@link VcfHeader}.
 * The first line (the file format line) is always skipped, and parsing stops at the
 * first line that does not start with <code>#</code>.
 */
public class VcfHeaderExtractor {

  private static final Pattern DEFINITION_ID = Pattern.compile("(\\w+)=<ID=([^,>]+)");
  private static final Splitter TAB = Splitter.on('\t');
  private static final int FIRST_SAMPLE_COLUMN = 9;

  public static VcfHeader extract(VcfLineSource source) {
    try (CloseableIterator<String> lines = source.openLines()) {
      return extract(lines, source.getName());
    }
  }

  public static VcfHeader extract(Iterator<String> lines, String sourceName) {
    Map<DefinitionCategory, Map<String, String>> definitions =
        new EnumMap<>(DefinitionCategory.class);
    for (DefinitionCategory category : DefinitionCategory.values()) {
      definitions.put(category, new LinkedHashMap<>());
    }
    List<String> otherLines = new ArrayList<>();
    List<String> sampleNames = new ArrayList<>();

    if (lines.hasNext()) {
      lines.next(); // ##fileformat
    }
    while (lines.hasNext()) {
      String line = StringUtils.chomp(lines.next());
      if (!line.startsWith("#")) {
        break;
      }
      DefinitionCategory category = DefinitionCategory.forLine(line);
      if (category != null) {
        definitions.get(category).put(parseId(line, sourceName), line);
      } else if (line.startsWith(VcfHeader.COLUMN_HEADER_PREFIX)) {
        sampleNames = parseSampleNames(line, sourceName);
      } else {
        otherLines.add(line);
      }
    }
    return new VcfHeader(definitions, otherLines, sampleNames);
  }

  private static String parseId(String line, String sourceName) {
    Matcher matcher = DEFINITION_ID.matcher(line);
    if (!matcher.find()) {
      throw new MalformedVcfException(sourceName, "no ID in header line: " + line);
    }
    return matcher.group(2);
  }

  private static List<String> parseSampleNames(String line, String sourceName) {
    List<String> columns = TAB.splitToList(line);
    List<String> sampleNames = columns.size() > FIRST_SAMPLE_COLUMN ?
        new ArrayList<>(columns.subList(FIRST_SAMPLE_COLUMN, columns.size())) :
        new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (String sampleName : sampleNames) {
      if (!seen.add(sampleName)) {
        throw new MalformedVcfException(sourceName, "duplicate sample " + sampleName);
      }
    }
    return sampleNames;
  }
}
