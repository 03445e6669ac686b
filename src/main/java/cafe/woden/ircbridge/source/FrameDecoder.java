package cafe.woden.ircbridge.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;

/**
 * Decodes raw DDP text frames.
 *
 * <p>The push stream carries partial and non-JSON noise (heartbeats, server ids), so anything
 * that does not decode to a JSON object with a {@code msg} field yields {@link Optional#empty()}.
 */
public final class FrameDecoder {

  private static final ObjectMapper JSON = new ObjectMapper();

  public Optional<DdpFrame> decode(String raw) {
    if (raw == null || raw.isBlank()) return Optional.empty();

    JsonNode root;
    try {
      root = JSON.readTree(raw);
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
    if (root == null || !root.isObject()) return Optional.empty();

    JsonNode msg = root.get("msg");
    if (msg == null || !msg.isTextual()) return Optional.empty();

    return Optional.of(new DdpFrame(
        msg.asText(),
        text(root.get("collection")),
        text(root.get("id")),
        Ejson.unescape(root.get("fields"))));
  }

  private static String text(JsonNode n) {
    return n == null || n.isNull() ? "" : n.asText("");
  }
}
