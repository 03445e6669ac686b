package cafe.woden.ircbridge.source;

/** Opens unconnected transports to a DDP endpoint. Supplied by the embedding application. */
@FunctionalInterface
public interface DdpTransportFactory {
  DdpTransport create(String host, int port, boolean secure);
}
