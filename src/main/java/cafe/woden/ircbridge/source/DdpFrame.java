package cafe.woden.ircbridge.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Objects;

/**
 * One decoded DDP message.
 *
 * <p>{@code msg} is the DDP message type ({@code added}, {@code changed}, {@code removed},
 * {@code result}, ...). {@code collection}, {@code id} and {@code fields} are only meaningful for
 * collection data messages and are empty/missing otherwise.
 */
public record DdpFrame(String msg, String collection, String id, JsonNode fields) {
  public static final String ADDED = "added";
  public static final String CHANGED = "changed";
  public static final String REMOVED = "removed";

  public DdpFrame {
    msg = Objects.toString(msg, "");
    collection = Objects.toString(collection, "");
    id = Objects.toString(id, "");
    fields = fields == null ? MissingNode.getInstance() : fields;
  }

  public boolean isCollectionData() {
    return !collection.isEmpty()
        && (ADDED.equals(msg) || CHANGED.equals(msg) || REMOVED.equals(msg));
  }

  public boolean is(String type, String collectionName) {
    return type.equals(msg) && collectionName.equals(collection);
  }
}
