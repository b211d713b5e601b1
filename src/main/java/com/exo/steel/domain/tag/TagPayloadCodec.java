package com.exo.steel.domain.tag;

import com.exo.steel.domain.ndef.ExternalRecord;
import com.exo.steel.domain.ndef.NdefFormatException;
import com.exo.steel.domain.ndef.NdefMessage;
import com.exo.steel.domain.ndef.NdefMessageCodec;
import com.exo.steel.domain.ndef.NdefRecord;
import com.exo.steel.domain.ndef.TextRecord;
import com.exo.steel.domain.ndef.UriRecord;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies the Steel tag rules on top of the NDEF codec.
 * <p><strong>Why:</strong> A tag must stay useful to non-members (URI fallback) while the app reads a
 * structured identifier (External record).</p>
 * <p><strong>Role:</strong> Record codec shared by the read and write paths of the tag session.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Encode the fixed URI, Text, External record trio.</li>
 *   <li>Extract the member id, preferring the External record over the URI fallback.</li>
 *   <li>Skip malformed individual records; fail only when no record yields an identifier.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class TagPayloadCodec {
  private static final Logger log = LoggerFactory.getLogger(TagPayloadCodec.class);
  private static final String CONNECT_SEGMENT = "connect";

  private final TagPayloadFormat format;
  private final NdefMessageCodec ndef;
  private final ExternalPayloadJson json = new ExternalPayloadJson();

  /**
   * Creates a codec using {@link TagPayloadFormat#defaults()}.
   */
  public TagPayloadCodec() {
    this(TagPayloadFormat.defaults());
  }

  /**
   * Creates a codec with explicit payload constants.
   *
   * @param format payload constants; must not be {@code null}
   */
  public TagPayloadCodec(TagPayloadFormat format) {
    this.format = Objects.requireNonNull(format, "format");
    this.ndef = new NdefMessageCodec();
  }

  /**
   * @return payload constants in use
   */
  public TagPayloadFormat format() {
    return format;
  }

  /**
   * Builds the three-record message. Callers pass the session clock's reading as the timestamp.
   *
   * @param memberId member identifier; must be non-empty
   * @param displayName display name written verbatim into the Text record
   * @param timestamp value of the external {@code timestamp} field
   * @return URI, Text, External records in that order
   */
  public NdefMessage encode(String memberId, String displayName, Instant timestamp) {
    Objects.requireNonNull(memberId, "memberId");
    Objects.requireNonNull(displayName, "displayName");
    Objects.requireNonNull(timestamp, "timestamp");
    if (memberId.isEmpty()) {
      throw new IllegalArgumentException("memberId must not be empty");
    }
    String segment = URLEncoder.encode(memberId, StandardCharsets.UTF_8).replace("+", "%20");
    return NdefMessage.of(
        new UriRecord(format.fallbackBaseUrl() + '/' + segment),
        new TextRecord(format.textLanguage(), displayName),
        new ExternalRecord(
            format.externalType(), json.write(memberId, timestamp, format.recordVersion())));
  }

  /**
   * Encodes straight to tag bytes.
   *
   * @param memberId member identifier
   * @param displayName display name
   * @param timestamp external payload timestamp
   * @return raw NDEF bytes ready for a tag write
   */
  public byte[] encodeBytes(String memberId, String displayName, Instant timestamp) {
    return ndef.encode(encode(memberId, displayName, timestamp));
  }

  /**
   * Decodes raw tag bytes into a sharer identity.
   *
   * @param bytes raw NDEF bytes
   * @return extracted identity
   * @throws TagFormatException when the bytes are not NDEF or carry no identifier
   */
  public TagIdentity decode(byte[] bytes) throws TagFormatException {
    NdefMessage message;
    try {
      message = ndef.decode(bytes);
    } catch (NdefFormatException ex) {
      throw new TagFormatException("Tag bytes are not a valid NDEF message", ex);
    }
    return decode(message);
  }

  /**
   * Extracts the sharer identity from a decoded message.
   *
   * @param message decoded message; records may appear in any order and any mix
   * @return extracted identity
   * @throws TagFormatException when neither an External record nor a URI fallback yields an id
   */
  public TagIdentity decode(NdefMessage message) throws TagFormatException {
    Objects.requireNonNull(message, "message");
    Optional<String> memberId = fromExternal(message).or(() -> fromUri(message));
    if (memberId.isEmpty()) {
      throw new TagFormatException("No Steel member id found in " + message.records().size() + " record(s)");
    }
    return new TagIdentity(memberId.get(), displayName(message));
  }

  private Optional<String> fromExternal(NdefMessage message) {
    for (NdefRecord record : message.records()) {
      if (record instanceof ExternalRecord external && format.externalType().equals(external.typeName())) {
        try {
          Optional<String> id = json.readMemberId(external.payloadBytes());
          if (id.isPresent()) {
            return id;
          }
          log.debug("External record {} carries no memberId", external.typeName());
        } catch (IOException ex) {
          log.debug("Skipping malformed external payload: {}", ex.getMessage());
        }
      }
    }
    return Optional.empty();
  }

  private Optional<String> fromUri(NdefMessage message) {
    for (NdefRecord record : message.records()) {
      if (record instanceof UriRecord uri) {
        Optional<String> id = connectSegment(uri.uri());
        if (id.isPresent()) {
          return id;
        }
      }
    }
    return Optional.empty();
  }

  private static Optional<String> connectSegment(String raw) {
    String path;
    try {
      path = new URI(raw).getRawPath();
    } catch (URISyntaxException ex) {
      log.debug("Skipping unparsable URI record: {}", ex.getMessage());
      return Optional.empty();
    }
    if (path == null) {
      return Optional.empty();
    }
    // Split before decoding so an escaped '/' stays inside the id.
    String[] segments = path.split("/");
    for (int i = 0; i < segments.length - 1; i++) {
      if (CONNECT_SEGMENT.equals(segments[i]) && !segments[i + 1].isEmpty()) {
        return decodeSegment(segments[i + 1]);
      }
    }
    return Optional.empty();
  }

  private static Optional<String> decodeSegment(String segment) {
    try {
      // '+' is literal in a path; URLDecoder would read it as a space.
      return Optional.of(URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8));
    } catch (IllegalArgumentException ex) {
      log.debug("Skipping URI record with malformed escape: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<String> displayName(NdefMessage message) {
    for (NdefRecord record : message.records()) {
      if (record instanceof TextRecord text && !text.text().isEmpty()) {
        return Optional.of(text.text());
      }
    }
    return Optional.empty();
  }
}
