package com.exo.steel.domain.ndef;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Well-known Text record ({@code TNF=WELL_KNOWN}, type {@code T}).
 *
 * <p>Wire layout is {@code [status][language][text]}. The low six bits of the status byte hold the
 * language length; bit 7 flags UTF-16 text. Encoding always writes UTF-8.</p>
 *
 * @param language IANA language tag, at most 63 ASCII bytes
 * @param text human-readable text
 * @since 0.1.0
 */
public record TextRecord(String language, String text) implements NdefRecord {
  static final byte[] TYPE = {'T'};
  private static final int UTF16_FLAG = 0x80;
  private static final int LANGUAGE_LENGTH_MASK = 0x3F;

  /**
   * Validates the language tag length against the status byte budget.
   */
  public TextRecord {
    Objects.requireNonNull(language, "language");
    Objects.requireNonNull(text, "text");
    if (language.getBytes(StandardCharsets.US_ASCII).length > LANGUAGE_LENGTH_MASK) {
      throw new IllegalArgumentException("language tag must be at most 63 bytes (was " + language + ')');
    }
  }

  @Override
  public TypeNameFormat tnf() {
    return TypeNameFormat.WELL_KNOWN;
  }

  @Override
  public byte[] type() {
    return TYPE.clone();
  }

  @Override
  public byte[] payload() {
    byte[] lang = language.getBytes(StandardCharsets.US_ASCII);
    byte[] body = text.getBytes(StandardCharsets.UTF_8);
    byte[] out = new byte[1 + lang.length + body.length];
    out[0] = (byte) lang.length;
    System.arraycopy(lang, 0, out, 1, lang.length);
    System.arraycopy(body, 0, out, 1 + lang.length, body.length);
    return out;
  }

  /**
   * Parses a Text payload.
   *
   * @param payload raw record payload
   * @return decoded record, or {@code null} when the status byte points past the payload
   */
  static TextRecord parse(byte[] payload) {
    if (payload == null || payload.length == 0) {
      return null;
    }
    int status = payload[0] & 0xFF;
    int langLength = status & LANGUAGE_LENGTH_MASK;
    if (1 + langLength > payload.length) {
      return null;
    }
    Charset charset = (status & UTF16_FLAG) != 0 ? StandardCharsets.UTF_16 : StandardCharsets.UTF_8;
    String language = new String(payload, 1, langLength, StandardCharsets.US_ASCII);
    String text = new String(payload, 1 + langLength, payload.length - 1 - langLength, charset);
    return new TextRecord(language, text);
  }
}
