package com.cloudera.datascience.vcfmerge;

import com.google.common.collect.AbstractIterator;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.RuntimeIOException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;

/**
 * Reads lines of UTF-8 text from a VCF file on the local filesystem. Files ending in
 * <code>.gz</code> (gzip or bgzip) are decompressed transparently.
 */
public class FileVcfLineSource implements VcfLineSource {

  private final File file;

  public FileVcfLineSource(File file) {
    this.file = file;
  }

  @Override
  public String getName() {
    return file.getPath();
  }

  @Override
  public CloseableIterator<String> openLines() {
    return new LineIterator(IOUtil.openFileForBufferedUtf8Reading(file), getName());
  }

  private static class LineIterator extends AbstractIterator<String>
      implements CloseableIterator<String> {
    private final BufferedReader reader;
    private final String name;

    LineIterator(BufferedReader reader, String name) {
      this.reader = reader;
      this.name = name;
    }

    @Override
    protected String computeNext() {
      try {
        String line = reader.readLine();
        if (line == null) {
          close();
          return endOfData();
        }
        return line;
      } catch (IOException e) {
        throw new RuntimeIOException("Error reading " + name, e);
      }
    }

    @Override
    public void close() {
      CloserUtil.close(reader);
    }
  }

  @Override
  public String toString() {
    return "FileVcfLineSource{" +
        "file=" + file +
        '}';
  }
}
