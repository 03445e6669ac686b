package cafe.woden.ircbridge.irc;

import java.util.Objects;

/** mIRC color control codes. */
public final class IrcFormatting {

  public static final char COLOR = '\u0003';

  public enum Color {
    WHITE("00"),
    BLACK("01"),
    BLUE("02"),
    GREEN("03"),
    RED("04"),
    BROWN("05"),
    PURPLE("06"),
    ORANGE("07"),
    YELLOW("08"),
    LIGHT_GREEN("09"),
    CYAN("10"),
    LIGHT_CYAN("11"),
    LIGHT_BLUE("12"),
    PINK("13"),
    GREY("14"),
    LIGHT_GREY("15");

    private final String code;

    Color(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }

  private IrcFormatting() {}

  public static String colored(String text, Color color) {
    String t = Objects.toString(text, "");
    if (t.isEmpty()) return t;
    return COLOR + color.code() + t + COLOR;
  }

  /** Remove color codes. */
  static String strip(String text) {
    if (text == null) return "";
    return text.replaceAll("\u0003(\\d{1,2}(,\\d{1,2})?)?", "");
  }
}
