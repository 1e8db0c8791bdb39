package userinfo;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller identity decoded from the user-info header, as forwarded by the authenticating proxy.
 *
 * <p>The payload is kept as an opaque JSON tree: object, array or scalar. Issuer, subject,
 * audience and the other claims are not interpreted here.
 *
 * @param payload the parsed JSON document
 */
public record UserInfo(JsonNode payload) {

  public UserInfo {
    Objects.requireNonNull(payload, "payload");
    payload = payload.deepCopy();
  }

  @Override
  public JsonNode payload() {
    return payload.deepCopy();
  }

  /** Top-level field of an object payload; empty for any other payload shape. */
  public Optional<JsonNode> claim(String name) {
    if (!payload.isObject() || !payload.has(name)) {
      return Optional.empty();
    }
    return Optional.of(payload.get(name).deepCopy());
  }
}
