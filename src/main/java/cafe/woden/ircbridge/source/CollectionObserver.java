package cafe.woden.ircbridge.source;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives document-level changes for one watched collection.
 *
 * <p>All methods default to no-ops so observers only implement what they care about.
 */
public interface CollectionObserver {

  default void onAdded(String id, JsonNode fields) {}

  default void onChanged(String id, JsonNode fields) {}

  default void onRemoved(String id) {}
}
