package com.cloudera.datascience.vcfmerge;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFFileReader;
import htsjdk.variant.vcf.VCFHeader;
import htsjdk.variant.vcf.VCFHeaderLineType;
import java.io.File;
import java.io.FileWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestVcfMerge {

  private static final File VCF_A = new File("src/test/resources/a.vcf");
  private static final File VCF_B = new File("src/test/resources/b.vcf");
  private static final File VCF_B_GZ = new File("src/test/resources/b.vcf.gz");

  private static final List<String> EXPECTED_HEADER = ImmutableList.of(
      "##fileformat=VCFv4.1",
      "##source=callerA",
      "##source=callerB",
      "##FORMAT=<ID=GT,Number=1,Type=String,Description=\"Genotype\">",
      "##FORMAT=<ID=SQ,Number=1,Type=Float,Description=\"Site quality\">",
      "##INFO=<ID=DP,Number=1,Type=Integer,Description=\"Total depth\">",
      "##INFO=<ID=SVLEN,Number=1,Type=Integer,Description=\"SV length\">",
      "##contig=<ID=chr1,length=10000>",
      "##contig=<ID=chr2,length=10000>",
      "##FILTER=<ID=LowQual,Description=\"Low quality\">",
      "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\tS2\tS3");

  private static final List<String> EXPECTED_RECORDS = ImmutableList.of(
      "chr1\t100\t.\tA\tT\t50\tPASS\tDP=10\tGT:SQ\t0/1:20\t./.:0",
      "chr1\t100\t.\tA\tT\t45\tPASS\tDP=11\tGT:SQ\t0/1:22\t1/1:30",
      "chr1\t250\t.\tG\tC\t40\tPASS\tDP=12\tGT:SQ\t0/0:30\t0|0:30",
      "chr1\t300\t.\tC\tG\t35\tPASS\tDP=7\tGT:SQ\t./.:0\t0/0:20",
      "chr1\t400\t.\tT\tA\t60\tPASS\tDP=8\tGT:SQ\t0/1:25\t1/1:40",
      "chr2\t10\t.\tC\tT\t30\tPASS\tDP=9\tGT:SQ\t0/0:33\t0/0:35",
      "chr2\t20\t.\tG\tA\t55\tPASS\tDP=13\tGT:SQ\t0/1:19\t0/1:18",
      "chr2\t500\t.\tA\tG\t70\tPASS\tDP=15\tGT:SQ\t1/1:50\t0/1:45",
      "chr2\t600\t.\tT\tC\t65\tPASS\tDP=14\tGT:SQ\t0/0:35\t0/0:30");

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static List<String> lines(StringWriter out) {
    return Splitter.on('\n').omitEmptyStrings().splitToList(out.toString());
  }

  private static List<String> concat(List<String> header, List<String> records) {
    return ImmutableList.<String>builder().addAll(header).addAll(records).build();
  }

  @Test
  public void testMergeFiles() throws Exception {
    StringWriter out = new StringWriter();
    RecordingMergeDiagnostics diagnostics = new RecordingMergeDiagnostics();
    VcfMerge.merge(new FileVcfLineSource(VCF_A), new FileVcfLineSource(VCF_B), false,
        out, diagnostics);

    assertEquals(concat(EXPECTED_HEADER, EXPECTED_RECORDS), lines(out));
    assertTrue(out.toString().endsWith("\n"));
    assertEquals(ImmutableList.of("FORMAT:SQ:" +
            "##FORMAT=<ID=SQ,Number=1,Type=Float,Description=\"Site quality\">"),
        diagnostics.conflicts);
    assertTrue(diagnostics.skips.isEmpty());
  }

  @Test
  public void testMergeCompressedFile() throws Exception {
    StringWriter out = new StringWriter();
    VcfMerge.merge(VCF_A, VCF_B_GZ, false, out);
    assertEquals(concat(EXPECTED_HEADER, EXPECTED_RECORDS), lines(out));
  }

  @Test
  public void testMergeRemoveRef() throws Exception {
    StringWriter out = new StringWriter();
    RecordingMergeDiagnostics diagnostics = new RecordingMergeDiagnostics();
    VcfMerge.merge(new FileVcfLineSource(VCF_A), new FileVcfLineSource(VCF_B), true,
        out, diagnostics);

    assertEquals(concat(EXPECTED_HEADER, ImmutableList.of(
        EXPECTED_RECORDS.get(0),
        EXPECTED_RECORDS.get(1),
        EXPECTED_RECORDS.get(4),
        EXPECTED_RECORDS.get(6),
        EXPECTED_RECORDS.get(7))), lines(out));
    assertEquals(ImmutableList.of(VCF_A.getPath() + ":2/5", VCF_B.getPath() + ":2/4"),
        diagnostics.skips);
  }

  @Test
  public void testMergedOutputIsReadable() throws Exception {
    File merged = folder.newFile("merged.vcf");
    try (Writer out = new FileWriter(merged)) {
      VcfMerge.merge(VCF_A, VCF_B, false, out);
    }
    try (VCFFileReader reader = new VCFFileReader(merged, false)) {
      VCFHeader header = reader.getFileHeader();
      assertEquals(ImmutableList.of("S2", "S3"), header.getGenotypeSamples());
      assertEquals(VCFHeaderLineType.Float, header.getFormatHeaderLine("SQ").getType());
      assertTrue(header.hasInfoLine("SVLEN"));

      List<VariantContext> variants = new ArrayList<>();
      Iterators.addAll(variants, reader.iterator());
      assertEquals(EXPECTED_RECORDS.size(), variants.size());
      assertEquals("chr1", variants.get(0).getContig());
      assertEquals(100, variants.get(0).getStart());
      assertTrue(variants.get(1).getGenotype("S3").isHomVar());
    }
  }

  @Test
  public void testSharedSubsetOfSamples() throws Exception {
    String columns = "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\t";
    ListVcfLineSource a = new ListVcfLineSource("a", ImmutableList.of(
        "##fileformat=VCFv4.1",
        columns + "S1\tS2\tS3",
        "chr1\t100\t.\tA\tT\t.\t.\t.\tGT\t0/0\t0/1\t./.",
        "chr1\t200\t.\tA\tT\t.\t.\t.\tGT\t0/1\t0/0\t0/0"));
    ListVcfLineSource b = new ListVcfLineSource("b", ImmutableList.of(
        "##fileformat=VCFv4.1",
        columns + "S2\tS3",
        "chr1\t100\t.\tA\tT\t.\t.\t.\tGT\t0/1\t1/1"));

    StringWriter out = new StringWriter();
    VcfMerge.merge(a, b, false, out, new RecordingMergeDiagnostics());
    assertEquals(ImmutableList.of(
        "##fileformat=VCFv4.1",
        columns + "S2\tS3",
        "chr1\t100\t.\tA\tT\t.\t.\t.\tGT\t0/1\t./.",
        "chr1\t100\t.\tA\tT\t.\t.\t.\tGT\t0/1\t1/1",
        "chr1\t200\t.\tA\tT\t.\t.\t.\tGT\t0/0\t0/0"), lines(out));
    assertEquals(2, a.getOpened());
    assertEquals(2, a.getClosed());

    out = new StringWriter();
    RecordingMergeDiagnostics diagnostics = new RecordingMergeDiagnostics();
    VcfMerge.merge(a, b, true, out, diagnostics);
    assertEquals(4, lines(out).size());
    assertEquals(ImmutableList.of("a:1/2", "b:0/1"), diagnostics.skips);
  }

  @Test
  public void testMalformedRecord() throws Exception {
    ListVcfLineSource a = new ListVcfLineSource("a", ImmutableList.of(
        "##fileformat=VCFv4.1",
        "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\tS1\tS2",
        "chr1\t100\t.\tA\tT\t.\t.\t.\tGT\t0/1"));
    ListVcfLineSource b = new ListVcfLineSource("b", ImmutableList.of(
        "##fileformat=VCFv4.1",
        "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\tS1"));
    try {
      VcfMerge.merge(a, b, false, new StringWriter(), new RecordingMergeDiagnostics());
      fail("expected MalformedVcfException");
    } catch (MalformedVcfException e) {
      assertEquals("a", e.getSourceName());
    }
    assertEquals(a.getOpened(), a.getClosed());
    assertEquals(b.getOpened(), b.getClosed());
  }

  @Test
  public void testNonAsciiText() throws Exception {
    List<String> lines = ImmutableList.of(
        "##fileformat=VCFv4.2",
        "##INFO=<ID=DP,Number=1,Type=Integer,Description=\"Tiefe \u00e4\">",
        "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\tS\u00e4mple",
        "chr1\t100\t.\tA\tT\t.\t.\tDP=3\tGT\t0/1");
    File first = folder.newFile("first.vcf");
    File second = folder.newFile("second.vcf");
    Files.write(first.toPath(), lines, StandardCharsets.UTF_8);
    Files.write(second.toPath(), lines, StandardCharsets.UTF_8);

    StringWriter out = new StringWriter();
    VcfMerge.merge(first, second, false, out);
    List<String> merged = lines(out);
    assertEquals(lines.get(1), merged.get(1));
    assertEquals("#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\tS\u00e4mple",
        merged.get(2));
  }
}
