package com.cloudera.datascience.vcfmerge;

import com.google.common.base.Joiner;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a merged header and merged records as tab-separated VCF text.
 */
public class VcfTextWriter {

  private static final Joiner TAB = Joiner.on('\t');

  private final Writer writer;

  public VcfTextWriter(Writer writer) {
    this.writer = writer;
  }

  /**
   * Write the file format line, the other metadata lines, the definition lines
   * (formats, infos, contigs, then filters) and the column header line.
   */
  public void writeHeader(VcfHeader header) throws IOException {
    writeLine(VcfHeader.FILE_FORMAT_LINE);
    for (String line : header.getOtherLines()) {
      writeLine(line);
    }
    for (DefinitionCategory category : DefinitionCategory.values()) {
      for (String line : header.getDefinitions(category).values()) {
        writeLine(line);
      }
    }
    List<String> columns = new ArrayList<>(VcfHeader.FIXED_COLUMNS);
    columns.addAll(header.getSampleNames());
    writeLine(TAB.join(columns));
  }

  public void writeRecord(VariantRecord record) throws IOException {
    writeLine(TAB.join(record.getColumns()));
  }

  public void flush() throws IOException {
    writer.flush();
  }

  private void writeLine(String line) throws IOException {
    writer.write(line);
    writer.write('\n');
  }
}
