package cafe.woden.ircbridge.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;

/**
 * Helpers for Meteor's EJSON extensions on top of plain JSON.
 *
 * <p>Dates travel as {@code {"$date": epochMillis}} and user objects whose only key starts with
 * {@code $} are wrapped in {@code {"$escape": {...}}}. Inbound {@code $date} and {@code $binary}
 * values are left as JSON; nothing the bridge reads from a frame is a date or binary field.
 */
public final class Ejson {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private Ejson() {}

  public static ObjectNode date(Instant at) {
    return date(at == null ? 0L : at.toEpochMilli());
  }

  private static ObjectNode date(long epochMillis) {
    ObjectNode n = NODES.objectNode();
    n.put("$date", epochMillis);
    return n;
  }

  /** Recursively remove {@code $escape} wrappers, leaving other EJSON types in place. */
  public static JsonNode unescape(JsonNode node) {
    if (node == null) return null;
    if (node.isArray()) {
      ArrayNode out = NODES.arrayNode(node.size());
      for (JsonNode child : node) out.add(unescape(child));
      return out;
    }
    if (!node.isObject()) return node;

    if (node.size() == 1 && node.has("$escape") && node.get("$escape").isObject()) {
      ObjectNode out = NODES.objectNode();
      Iterator<Map.Entry<String, JsonNode>> it = node.get("$escape").fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        out.set(e.getKey(), unescape(e.getValue()));
      }
      return out;
    }

    ObjectNode out = NODES.objectNode();
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.set(e.getKey(), unescape(e.getValue()));
    }
    return out;
  }
}
