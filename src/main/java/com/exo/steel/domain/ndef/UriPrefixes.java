package com.exo.steel.domain.ndef;

import java.util.List;

/**
 * URI identifier codes from the NFC Forum URI record type definition.
 *
 * <p>The first payload byte of a well-known {@code U} record abbreviates a common scheme prefix.
 * Codes outside the table are reserved and decode as "no prefix".</p>
 *
 * @since 0.1.0
 */
final class UriPrefixes {
  private static final List<String> PREFIXES = List.of(
      "",
      "http://www.",
      "https://www.",
      "http://",
      "https://",
      "tel:",
      "mailto:",
      "ftp://anonymous:anonymous@",
      "ftp://ftp.",
      "ftps://",
      "sftp://",
      "smb://",
      "nfs://",
      "ftp://",
      "dav://",
      "news:",
      "telnet://",
      "imap:",
      "rtsp://",
      "urn:",
      "pop:",
      "sip:",
      "sips:",
      "tftp:",
      "btspp://",
      "btl2cap://",
      "btgoep://",
      "tcpobex://",
      "irdaobex://",
      "file://",
      "urn:epc:id:",
      "urn:epc:tag:",
      "urn:epc:pat:",
      "urn:epc:raw:",
      "urn:epc:",
      "urn:nfc:");

  private UriPrefixes() {}

  static String expand(int code) {
    if (code < 0 || code >= PREFIXES.size()) {
      return "";
    }
    return PREFIXES.get(code);
  }

  /**
   * Finds the longest known prefix of {@code uri}.
   *
   * @param uri full URI
   * @return identifier code, {@code 0} when no prefix applies
   */
  static int codeFor(String uri) {
    int best = 0;
    int bestLength = 0;
    for (int i = 1; i < PREFIXES.size(); i++) {
      String prefix = PREFIXES.get(i);
      if (prefix.length() > bestLength && uri.startsWith(prefix)) {
        best = i;
        bestLength = prefix.length();
      }
    }
    return best;
  }
}
