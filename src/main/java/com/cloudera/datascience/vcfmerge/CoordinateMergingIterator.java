package com.cloudera.datascience.vcfmerge;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Merges streams of records, each sorted by contig and position, into a single
 * stream ordered by contig, position and source rank. The stream at index
 * <code>i</code> must only produce records with source rank <code>i</code>.
 * <p>
 * At most one record per stream is held in the queue. When the contig changes, the
 * record that starts the new contig and every other queued record are emitted
 * straight away, and the queue is reseeded with the next record from each stream
 * before normal ordering resumes. Contigs are compared as text, so all streams must
 * order their contigs the same way.
 */
public class CoordinateMergingIterator extends AbstractIterator<VariantRecord> {

  private final List<Iterator<VariantRecord>> streams;
  private final PriorityQueue<VariantRecord> queue = new PriorityQueue<>();
  private final LinkedList<VariantRecord> buffer = new LinkedList<>();
  private boolean seeded;
  private String lastContig;

  public CoordinateMergingIterator(List<? extends Iterator<VariantRecord>> streams) {
    this.streams = ImmutableList.copyOf(streams);
  }

  @Override
  protected VariantRecord computeNext() {
    if (!buffer.isEmpty()) {
      return buffer.removeFirst();
    }
    if (!seeded) {
      refillAll();
      seeded = true;
    }
    if (queue.isEmpty()) {
      return endOfData();
    }

    VariantRecord current = queue.poll();
    if (lastContig != null && !lastContig.equals(current.getContig())) {
      // contig boundary: flush what is queued, then start over
      buffer.add(current);
      while (!queue.isEmpty()) {
        buffer.add(queue.poll());
      }
      refillAll();
      if (queue.isEmpty()) {
        return buffer.removeFirst();
      }
      current = queue.poll();
    }
    lastContig = current.getContig();
    refill(streams.get(current.getSourceRank()));
    buffer.add(current);
    return buffer.removeFirst();
  }

  private void refillAll() {
    for (Iterator<VariantRecord> stream : streams) {
      refill(stream);
    }
  }

  private void refill(Iterator<VariantRecord> stream) {
    if (stream.hasNext()) {
      queue.add(stream.next());
    }
  }
}
