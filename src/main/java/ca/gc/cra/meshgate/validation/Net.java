package ca.gc.cra.meshgate.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Endpoint validation for gateway addresses and HTTP bind hosts.
 * <p>Accepts hostnames, IPv4 dotted quads, and bracketed IPv6 literals. Results are normalized to
 * {@code host:port} so logs and connection attempts always see the same spelling.</p>
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a strict {@code host:port} endpoint.
   *
   * @param value endpoint text
   * @return normalized endpoint
   * @throws IllegalArgumentException if the host or port is malformed
   */
  public static String validateHostPort(String value) {
    return validateHostPort(value, -1);
  }

  /**
   * Validates an endpoint, falling back to {@code defaultPort} when the port is omitted.
   *
   * @param value endpoint text; {@code host}, {@code host:port}, {@code [v6]} or {@code [v6]:port}
   * @param defaultPort port used when none is given, or {@code -1} to require one
   * @return normalized {@code host:port}
   * @throws IllegalArgumentException if the host or port is malformed
   */
  public static String validateHostPort(String value, int defaultPort) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    String normalizedHost;

    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      host = sanitized.substring(1, idx);
      validateIpv6(host);
      normalizedHost = '[' + host + ']';
      if (idx == sanitized.length() - 1) {
        portPart = null;
      } else if (sanitized.charAt(idx + 1) == ':' && idx + 2 < sanitized.length()) {
        portPart = sanitized.substring(idx + 2);
      } else {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon < 0) {
        host = sanitized;
        portPart = null;
      } else {
        if (lastColon == 0 || lastColon == sanitized.length() - 1) {
          throw new IllegalArgumentException("host:port must use HOST:PORT format");
        }
        host = sanitized.substring(0, lastColon);
        portPart = sanitized.substring(lastColon + 1);
        if (host.indexOf(':') >= 0) {
          throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
        }
      }
      checkHost(host);
      normalizedHost = host;
    }

    int port;
    if (portPart == null) {
      if (defaultPort < 0) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format");
      }
      port = defaultPort;
    } else {
      try {
        port = Integer.parseInt(portPart);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
      }
    }
    Numbers.requireRange("port", port, 1, 65535);
    return normalizedHost + ':' + port;
  }

  /**
   * Validates a bare host used for binding a listener.
   *
   * @param value hostname, IPv4 address, or IPv6 literal (with or without brackets)
   * @return host with brackets removed from IPv6 literals
   * @throws IllegalArgumentException if the host is malformed
   */
  public static String validateHost(String value) {
    String sanitized = Strings.requireNonBlank("host", value);
    if (sanitized.startsWith("[") && sanitized.endsWith("]")) {
      sanitized = sanitized.substring(1, sanitized.length() - 1);
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(sanitized);
      return sanitized;
    }
    checkHost(sanitized);
    return sanitized;
  }

  private static void checkHost(String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      int start = 0;
      for (int i = 0; i < 4; i++) {
        int end = (i < 3) ? host.indexOf('.', start) : host.length();
        Numbers.requireRange("IPv4 octet", Integer.parseInt(host.substring(start, end)), 0, 255);
        start = end + 1;
      }
      return;
    }
    int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    for (String label : host.split("\\.", -1)) {
      checkLabel(label);
    }
  }

  private static void checkLabel(String label) {
    int len = label.length();
    if (len == 0 || len > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + len + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(len - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = 1; i < len - 1; i++) {
      char c = label.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv6(String host) {
    if (host.isEmpty() || !host.matches("[0-9A-Fa-f:.]+(%[A-Za-z0-9]+)?")) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host);
    }
    try {
      // literal parsing only; no DNS lookup for hex/colon input
      InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
