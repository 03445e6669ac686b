package cafe.woden.ircbridge.app;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates ids for outbound messages in MongoDB ObjectId layout: 24 lowercase hex characters
 * made of epoch seconds, 5 random bytes and a 3-byte counter.
 */
final class MessageIds {

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private final byte[] processUnique = new byte[5];
  private final AtomicInteger counter;

  MessageIds() {
    RANDOM.nextBytes(processUnique);
    counter = new AtomicInteger(RANDOM.nextInt(0x00ffffff));
  }

  String next() {
    int seconds = (int) Instant.now().getEpochSecond();
    int count = counter.getAndIncrement() & 0x00ffffff;

    byte[] raw = new byte[12];
    raw[0] = (byte) (seconds >>> 24);
    raw[1] = (byte) (seconds >>> 16);
    raw[2] = (byte) (seconds >>> 8);
    raw[3] = (byte) seconds;
    System.arraycopy(processUnique, 0, raw, 4, 5);
    raw[9] = (byte) (count >>> 16);
    raw[10] = (byte) (count >>> 8);
    raw[11] = (byte) count;

    char[] out = new char[24];
    for (int i = 0; i < raw.length; i++) {
      out[i * 2] = HEX[(raw[i] >>> 4) & 0x0f];
      out[i * 2 + 1] = HEX[raw[i] & 0x0f];
    }
    return new String(out);
  }
}
