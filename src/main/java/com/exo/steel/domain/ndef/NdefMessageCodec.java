package com.exo.steel.domain.ndef;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Converts NDEF messages to and from their raw tag bytes.
 * <p><strong>Why:</strong> Tags expose a single byte blob; the Steel rules need typed records.</p>
 * <p><strong>Role:</strong> Leaf domain codec used by the tag payload codec on read and write paths.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse record headers (MB, ME, CF, SR, IL, TNF), short and long payload lengths, and optional ids.</li>
 *   <li>Map well-known {@code U}/{@code T} and external records to typed values.</li>
 *   <li>Keep malformed well-known records as {@link OpaqueRecord}s instead of failing the whole message.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Chunked records are rejected; tags written by Steel never chunk.
 * @since 0.1.0
 */
public final class NdefMessageCodec {
  private static final int FLAG_MB = 0x80;
  private static final int FLAG_ME = 0x40;
  private static final int FLAG_CF = 0x20;
  private static final int FLAG_SR = 0x10;
  private static final int FLAG_IL = 0x08;
  private static final int SHORT_RECORD_MAX = 0xFF;

  /**
   * Creates a codec.
   */
  public NdefMessageCodec() {}

  /**
   * Parses raw tag bytes into a message.
   *
   * @param bytes raw NDEF message; {@code null} or empty yields an empty message
   * @return decoded message
   * @throws NdefFormatException when a header or length field runs past the buffer or flags are inconsistent
   */
  public NdefMessage decode(byte[] bytes) throws NdefFormatException {
    if (bytes == null || bytes.length == 0) {
      return new NdefMessage(List.of());
    }
    List<NdefRecord> records = new ArrayList<>();
    int offset = 0;
    boolean sawEnd = false;
    while (offset < bytes.length) {
      if (sawEnd) {
        throw new NdefFormatException("trailing bytes after message end at offset " + offset);
      }
      int header = bytes[offset++] & 0xFF;
      if (records.isEmpty() && (header & FLAG_MB) == 0) {
        throw new NdefFormatException("first record is missing the message-begin flag");
      }
      if ((header & FLAG_CF) != 0) {
        throw new NdefFormatException("chunked records are not supported");
      }
      offset = require(bytes, offset, 1, "type length");
      int typeLength = bytes[offset - 1] & 0xFF;

      long payloadLength;
      if ((header & FLAG_SR) != 0) {
        offset = require(bytes, offset, 1, "short payload length");
        payloadLength = bytes[offset - 1] & 0xFF;
      } else {
        offset = require(bytes, offset, 4, "payload length");
        payloadLength = ((long) (bytes[offset - 4] & 0xFF) << 24)
            | ((bytes[offset - 3] & 0xFF) << 16)
            | ((bytes[offset - 2] & 0xFF) << 8)
            | (bytes[offset - 1] & 0xFF);
      }
      int idLength = 0;
      if ((header & FLAG_IL) != 0) {
        offset = require(bytes, offset, 1, "id length");
        idLength = bytes[offset - 1] & 0xFF;
      }
      if (payloadLength > bytes.length) {
        throw new NdefFormatException("payload length " + payloadLength + " exceeds message size");
      }

      offset = require(bytes, offset, typeLength, "type");
      byte[] type = Arrays.copyOfRange(bytes, offset - typeLength, offset);
      offset = require(bytes, offset, idLength, "id");
      offset = require(bytes, offset, (int) payloadLength, "payload");
      byte[] payload = Arrays.copyOfRange(bytes, offset - (int) payloadLength, offset);

      records.add(toRecord(TypeNameFormat.fromHeader(header), type, payload));
      sawEnd = (header & FLAG_ME) != 0;
    }
    if (!sawEnd) {
      throw new NdefFormatException("message is missing the message-end flag");
    }
    return new NdefMessage(records);
  }

  /**
   * Serializes a message using short records where the payload fits.
   *
   * @param message message to encode; must contain at least one record
   * @return raw NDEF bytes
   */
  public byte[] encode(NdefMessage message) {
    Objects.requireNonNull(message, "message");
    List<NdefRecord> records = message.records();
    if (records.isEmpty()) {
      throw new IllegalArgumentException("message must contain at least one record");
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (int i = 0; i < records.size(); i++) {
      NdefRecord record = records.get(i);
      byte[] type = record.type();
      byte[] payload = record.payload();
      if (type.length > SHORT_RECORD_MAX) {
        throw new IllegalArgumentException("record type exceeds 255 bytes");
      }
      boolean shortRecord = payload.length <= SHORT_RECORD_MAX;
      int header = record.tnf().code();
      if (i == 0) {
        header |= FLAG_MB;
      }
      if (i == records.size() - 1) {
        header |= FLAG_ME;
      }
      if (shortRecord) {
        header |= FLAG_SR;
      }
      out.write(header);
      out.write(type.length);
      if (shortRecord) {
        out.write(payload.length);
      } else {
        out.write((payload.length >>> 24) & 0xFF);
        out.write((payload.length >>> 16) & 0xFF);
        out.write((payload.length >>> 8) & 0xFF);
        out.write(payload.length & 0xFF);
      }
      out.writeBytes(type);
      out.writeBytes(payload);
    }
    return out.toByteArray();
  }

  private static NdefRecord toRecord(TypeNameFormat tnf, byte[] type, byte[] payload) {
    if (tnf == TypeNameFormat.WELL_KNOWN && type.length == 1) {
      NdefRecord parsed = switch ((char) type[0]) {
        case 'U' -> UriRecord.parse(payload);
        case 'T' -> TextRecord.parse(payload);
        default -> null;
      };
      if (parsed != null) {
        return parsed;
      }
    }
    if (tnf == TypeNameFormat.EXTERNAL && type.length > 0) {
      return new ExternalRecord(new String(type, StandardCharsets.UTF_8), payload);
    }
    return new OpaqueRecord(tnf, type, payload);
  }

  private static int require(byte[] bytes, int offset, int length, String field)
      throws NdefFormatException {
    if (length < 0 || offset + length > bytes.length) {
      throw new NdefFormatException("truncated " + field + " at offset " + offset);
    }
    return offset + length;
  }
}
