package com.exo.steel.domain.ndef;

import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of NDEF records; list order is wire order.
 *
 * @param records records in wire order; copied to an immutable list
 * @since 0.1.0
 */
public record NdefMessage(List<NdefRecord> records) {

  /**
   * Copies the record list.
   */
  public NdefMessage {
    records = List.copyOf(Objects.requireNonNull(records, "records"));
  }

  /**
   * Convenience factory for literal messages.
   *
   * @param records records in wire order
   * @return message wrapping the records
   */
  public static NdefMessage of(NdefRecord... records) {
    return new NdefMessage(List.of(records));
  }

  /**
   * Reports whether the message carries no meaningful record.
   *
   * <p>A message holding only {@link TypeNameFormat#EMPTY} records is the NDEF encoding of a blank
   * tag and counts as empty.</p>
   *
   * @return {@code true} when there is nothing to interpret
   */
  public boolean isEmpty() {
    for (NdefRecord record : records) {
      if (record.tnf() != TypeNameFormat.EMPTY) {
        return false;
      }
    }
    return true;
  }
}
