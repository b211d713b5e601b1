package com.exo.steel.domain.tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.exo.steel.domain.ndef.ExternalRecord;
import com.exo.steel.domain.ndef.NdefMessage;
import com.exo.steel.domain.ndef.TextRecord;
import com.exo.steel.domain.ndef.UriRecord;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TagPayloadCodecTest {
  private static final Instant WRITTEN_AT = Instant.parse("2025-03-01T12:00:00Z");
  private final TagPayloadCodec codec = new TagPayloadCodec();

  @Test
  void encodedIdentityDecodesToSameMember() throws TagFormatException {
    byte[] bytes = codec.encodeBytes("steel_001", "Alex Rivera", WRITTEN_AT);

    TagIdentity identity = codec.decode(bytes);

    assertEquals("steel_001", identity.memberId());
    assertEquals(Optional.of("Alex Rivera"), identity.displayName());
  }

  @Test
  void encodeWritesUriTextExternalInOrder() {
    NdefMessage message = codec.encode("steel_001", "Alex", WRITTEN_AT);

    assertEquals(3, message.records().size());
    UriRecord uri = assertInstanceOf(UriRecord.class, message.records().get(0));
    assertEquals("https://steel.byexo.com/connect/steel_001", uri.uri());
    TextRecord text = assertInstanceOf(TextRecord.class, message.records().get(1));
    assertEquals("en", text.language());
    ExternalRecord external = assertInstanceOf(ExternalRecord.class, message.records().get(2));
    assertEquals("com.exo.steel:connect", external.typeName());
    String json = new String(external.payloadBytes(), StandardCharsets.UTF_8);
    assertEquals("{\"memberId\":\"steel_001\",\"timestamp\":\"2025-03-01T12:00:00Z\",\"version\":\"1.0\"}", json);
  }

  @Test
  void uriFallbackYieldsMemberWhenOnlyUriPresent() throws TagFormatException {
    NdefMessage message = NdefMessage.of(new UriRecord("https://steel.byexo.com/connect/X"));

    assertEquals("X", codec.decode(message).memberId());
  }

  @Test
  void uriFallbackKeepsEscapedCharactersInsideMemberId() throws TagFormatException {
    for (String memberId : new String[] {"a/b", "team 7", "a+b", "née"}) {
      UriRecord uri = assertInstanceOf(UriRecord.class, codec.encode(memberId, "x", WRITTEN_AT).records().get(0));

      assertEquals(memberId, codec.decode(NdefMessage.of(uri)).memberId(), uri.uri());
    }
  }

  @Test
  void uriWithMalformedEscapeIsNotAnIdentifier() {
    NdefMessage message = NdefMessage.of(new UriRecord("https://steel.byexo.com/connect/a%2"));

    assertThrows(TagFormatException.class, () -> codec.decode(message));
  }

  @Test
  void externalRecordTakesPriorityOverUri() throws TagFormatException {
    NdefMessage message = NdefMessage.of(
        new UriRecord("https://steel.byexo.com/connect/A"),
        external("{\"memberId\":\"B\"}"));

    assertEquals("B", codec.decode(message).memberId());
  }

  @Test
  void malformedExternalPayloadFallsBackToUri() throws TagFormatException {
    NdefMessage message = NdefMessage.of(
        external("not json"),
        new UriRecord("https://steel.byexo.com/connect/fallback"));

    assertEquals("fallback", codec.decode(message).memberId());
  }

  @Test
  void externalOfOtherTypeIsIgnored() {
    NdefMessage message = NdefMessage.of(
        new ExternalRecord("com.other:thing", "{\"memberId\":\"B\"}".getBytes(StandardCharsets.UTF_8)));

    TagFormatException ex = assertThrows(TagFormatException.class, () -> codec.decode(message));
    assertEquals(TagError.INVALID_TAG_FORMAT, ex.error());
  }

  @Test
  void messageWithoutIdentifierIsInvalid() {
    NdefMessage message = NdefMessage.of(new TextRecord("en", "Hello"));

    TagFormatException ex = assertThrows(TagFormatException.class, () -> codec.decode(message));
    assertEquals(TagError.INVALID_TAG_FORMAT, ex.error());
  }

  @Test
  void uriWithoutConnectSegmentIsNotAnIdentifier() {
    NdefMessage message = NdefMessage.of(new UriRecord("https://example.com/profile/X"));

    assertThrows(TagFormatException.class, () -> codec.decode(message));
  }

  @Test
  void garbageBytesAreInvalid() {
    TagFormatException ex = assertThrows(TagFormatException.class, () -> codec.decode(new byte[] {0x01, 0x02}));
    assertEquals(TagError.INVALID_TAG_FORMAT, ex.error());
  }

  @Test
  void emptyDisplayNameIsAbsent() throws TagFormatException {
    TagIdentity identity = codec.decode(codec.encodeBytes("steel_002", "", WRITTEN_AT));

    assertEquals("steel_002", identity.memberId());
    assertTrue(identity.displayName().isEmpty());
  }

  @Test
  void emptyMemberIdIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> codec.encode("", "name", WRITTEN_AT));
  }

  @Test
  void customFormatChangesBaseUrlAndType() throws TagFormatException {
    TagPayloadCodec custom = new TagPayloadCodec(
        new TagPayloadFormat("https://example.test/connect", "com.example:id", "2.0", "fr"));
    NdefMessage message = custom.encode("m-9", "Nom", WRITTEN_AT);

    assertEquals("https://example.test/connect/m-9", ((UriRecord) message.records().get(0)).uri());
    assertEquals("m-9", custom.decode(message).memberId());
  }

  private static ExternalRecord external(String json) {
    return new ExternalRecord(TagPayloadFormat.DEFAULT_EXTERNAL_TYPE, json.getBytes(StandardCharsets.UTF_8));
  }
}
