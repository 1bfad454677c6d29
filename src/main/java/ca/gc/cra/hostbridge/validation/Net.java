package ca.gc.cra.hostbridge.validation;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for the bridge listener and client.
 *
 * <p>The bridge only ever binds to or dials the local machine, so host values are restricted to loopback
 * literals and {@code localhost}.</p>
 */
public final class Net {

  private static final Set<String> LOOPBACK_NAMES = Set.of("localhost", "127.0.0.1", "::1", "[::1]");

  // IPv4 dotted-quad shape (fast pre-check); octets are range-checked separately.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates that {@code host} names the loopback interface.
   *
   * @param host candidate host (IPv4 {@code 127.0.0.0/8}, {@code ::1} or {@code localhost})
   * @return normalized host, with IPv6 brackets removed
   * @throws IllegalArgumentException when the host is not a loopback address
   */
  public static String requireLoopbackHost(String host) {
    String sanitized = Strings.requireNonBlank("host", host).toLowerCase(Locale.ROOT);
    if (LOOPBACK_NAMES.contains(sanitized)) {
      return sanitized.equals("[::1]") ? "::1" : sanitized;
    }
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      validateIpv4Octets(sanitized);
      if (sanitized.startsWith("127.")) {
        return sanitized;
      }
    }
    throw new IllegalArgumentException("host must be a loopback address (was " + host + ")");
  }

  /**
   * Resolves a validated loopback host to an {@link InetAddress} without touching DNS for literals.
   *
   * @param host host previously accepted by {@link #requireLoopbackHost(String)}
   * @return loopback address
   * @throws IllegalArgumentException if resolution fails or yields a non-loopback address
   */
  public static InetAddress loopbackAddress(String host) {
    String normalized = requireLoopbackHost(host);
    if (normalized.equals("localhost")) {
      return InetAddress.getLoopbackAddress();
    }
    try {
      InetAddress address = InetAddress.getByName(normalized);
      if (!address.isLoopbackAddress()) {
        throw new IllegalArgumentException("host does not resolve to loopback: " + host);
      }
      return address;
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid loopback host: " + host, ex);
    }
  }

  /**
   * Validates a TCP port.
   *
   * @param port candidate port
   * @param allowEphemeral whether {@code 0} (kernel-assigned) is accepted
   * @return the validated port
   */
  public static int requirePort(int port, boolean allowEphemeral) {
    return (int) Numbers.requireRange("port", port, allowEphemeral ? 0 : 1, 65535);
  }

  /** Parses and range-checks IPv4 octets (0..255). */
  private static void validateIpv4Octets(String host) {
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? host.indexOf('.', startIndex) : host.length();
      final int octet = Integer.parseInt(host.substring(startIndex, endIndex));
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      startIndex = endIndex + 1;
    }
  }
}
