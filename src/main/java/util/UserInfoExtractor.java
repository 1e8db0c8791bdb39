package util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import userinfo.UserInfo;
import userinfo.UserInfoConfiguration;
import userinfo.UserInfoErrorKind;
import userinfo.UserInfoException;

/**
 * Reads the identity assertion that the upstream proxy forwards as base64-encoded JSON in the
 * user-info header.
 *
 * <p>Stateless: one instance serves all requests. When the header is repeated the first value
 * wins.
 */
@Singleton
public class UserInfoExtractor {

  private static final Logger LOG = LoggerFactory.getLogger(UserInfoExtractor.class);

  private final String headerName;
  private final ObjectReader jsonReader;

  public UserInfoExtractor(UserInfoConfiguration configuration, ObjectMapper objectMapper) {
    this.headerName = configuration.getHeaderName();
    this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  public String getHeaderName() {
    return headerName;
  }

  public UserInfo extract(HttpRequest<?> request) {
    return extract(request.getHeaders());
  }

  public UserInfo extract(HttpHeaders headers) {
    Optional<String> value = headers.get(headerName, String.class);
    if (value.isEmpty()) {
      throw new UserInfoException(UserInfoErrorKind.HEADER_MISSING, headerName);
    }
    return decode(value.get());
  }

  /**
   * Trims, base64-decodes and parses an already located header value. Only ASCII whitespace
   * (space, tab, line feed, carriage return, form feed) is stripped from the edges.
   */
  public UserInfo decode(String rawValue) {
    String trimmed = trimAsciiWhitespace(rawValue);

    byte[] decoded;
    try {
      decoded = decodeBase64(trimmed);
    } catch (IllegalArgumentException e) {
      LOG.error("[{}] Failed to decode base 64 due to : {}", headerName, e.getMessage());
      throw new UserInfoException(UserInfoErrorKind.INVALID_BASE64, headerName, e);
    }

    JsonNode payload;
    try {
      payload = parseJson(decoded);
    } catch (IOException e) {
      LOG.error("[{}] Failed to parse JSON due to : {}", headerName, e.getMessage());
      throw new UserInfoException(UserInfoErrorKind.INVALID_JSON, headerName, e);
    }
    return new UserInfo(payload);
  }

  private static String trimAsciiWhitespace(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && isAsciiWhitespace(value.charAt(start))) {
      start++;
    }
    while (end > start && isAsciiWhitespace(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(start, end);
  }

  private static boolean isAsciiWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
  }

  // The JDK decoder tolerates missing padding and stray trailing bits; only the canonical padded
  // form is accepted here.
  private static byte[] decodeBase64(String value) {
    if (value.length() % 4 != 0) {
      throw new IllegalArgumentException("Invalid input length " + value.length());
    }
    byte[] decoded = Base64.getDecoder().decode(value);
    if (!Base64.getEncoder().encodeToString(decoded).equals(value)) {
      throw new IllegalArgumentException("Invalid last symbol");
    }
    return decoded;
  }

  private JsonNode parseJson(byte[] bytes) throws IOException {
    JsonNode node = jsonReader.readTree(bytes);
    if (node == null || node.isMissingNode()) {
      throw new IOException("No content to parse");
    }
    return node;
  }
}
