package com.cloudera.datascience.vcfmerge;

/**
 * Thrown when a VCF source does not follow the structure the merge relies on: a
 * definition line without an <code>ID</code>, a duplicated sample name, or a data
 * line that is too short or has a non-numeric position.
 */
public class MalformedVcfException extends RuntimeException {

  private final String sourceName;

  public MalformedVcfException(String sourceName, String message) {
    super(sourceName + ": " + message);
    this.sourceName = sourceName;
  }

  public MalformedVcfException(String sourceName, String message, Throwable cause) {
    super(sourceName + ": " + message, cause);
    this.sourceName = sourceName;
  }

  public String getSourceName() {
    return sourceName;
  }
}
