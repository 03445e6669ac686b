package cafe.woden.ircbridge.app;

import java.util.List;

/** Detects broadcast mentions such as {@code @here}. Case-sensitive substring match. */
public final class HighlightDetector {

  private final List<String> terms;

  public HighlightDetector(List<String> terms) {
    this.terms = terms == null ? List.of() : List.copyOf(terms);
  }

  public boolean isHighlight(String line) {
    if (line == null || line.isEmpty()) return false;
    for (String term : terms) {
      if (line.contains(term)) return true;
    }
    return false;
  }
}
