package com.exo.steel.domain.ndef;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Well-known URI record ({@code TNF=WELL_KNOWN}, type {@code U}).
 *
 * @param uri fully expanded URI; never {@code null}
 * @since 0.1.0
 */
public record UriRecord(String uri) implements NdefRecord {
  static final byte[] TYPE = {'U'};

  /**
   * Validates the URI value.
   */
  public UriRecord {
    Objects.requireNonNull(uri, "uri");
  }

  @Override
  public TypeNameFormat tnf() {
    return TypeNameFormat.WELL_KNOWN;
  }

  @Override
  public byte[] type() {
    return TYPE.clone();
  }

  /**
   * Encodes the URI using the shortest matching identifier code.
   *
   * @return {@code [code][remainder utf-8]}
   */
  @Override
  public byte[] payload() {
    int code = UriPrefixes.codeFor(uri);
    byte[] rest = uri.substring(UriPrefixes.expand(code).length()).getBytes(StandardCharsets.UTF_8);
    byte[] out = new byte[rest.length + 1];
    out[0] = (byte) code;
    System.arraycopy(rest, 0, out, 1, rest.length);
    return out;
  }

  /**
   * Parses a URI payload.
   *
   * @param payload raw record payload
   * @return decoded record, or {@code null} when the payload is empty
   */
  static UriRecord parse(byte[] payload) {
    if (payload == null || payload.length == 0) {
      return null;
    }
    String prefix = UriPrefixes.expand(payload[0] & 0xFF);
    String rest = new String(Arrays.copyOfRange(payload, 1, payload.length), StandardCharsets.UTF_8);
    return new UriRecord(prefix + rest);
  }
}
