package com.exo.steel.domain.tag;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Streams the external record JSON body {@code {memberId, timestamp, version}}.
 *
 * @since 0.1.0
 */
final class ExternalPayloadJson {
  static final String MEMBER_ID = "memberId";
  static final String TIMESTAMP = "timestamp";
  static final String VERSION = "version";

  private final JsonFactory factory = new JsonFactory();

  byte[] write(String memberId, Instant timestamp, String version) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(96);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeStringField(MEMBER_ID, memberId);
      generator.writeStringField(
          TIMESTAMP, DateTimeFormatter.ISO_INSTANT.format(timestamp.truncatedTo(ChronoUnit.SECONDS)));
      generator.writeStringField(VERSION, version);
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write external payload", ex);
    }
    return out.toByteArray();
  }

  /**
   * Reads the {@code memberId} field of a JSON object.
   *
   * @param payload UTF-8 JSON bytes
   * @return non-empty member id when present as a string
   * @throws IOException when the payload is not a well-formed JSON object
   */
  Optional<String> readMemberId(byte[] payload) throws IOException {
    try (JsonParser parser = factory.createParser(payload)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IOException("external payload is not a JSON object");
      }
      String memberId = null;
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        if (token == null) {
          throw new IOException("unterminated JSON object");
        }
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if (MEMBER_ID.equals(field) && value == JsonToken.VALUE_STRING) {
          memberId = parser.getText();
        } else {
          parser.skipChildren();
        }
      }
      if (memberId == null || memberId.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(memberId);
    }
  }
}
