package com.gentoro.reportbatch.security;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One allowlist pattern. Supported forms: an exact host name ({@code example.com}), a
 * sub-domain wildcard ({@code *.example.com}), an IP literal ({@code 203.0.113.7}) and a CIDR
 * block ({@code 203.0.113.0/24}, {@code 2001:db8::/32}).
 */
public final class AllowlistEntry {
  private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

  private final String pattern;
  private final String host;
  private final boolean wildcard;
  private final byte[] network;
  private final int prefixLength;

  private AllowlistEntry(
      String pattern, String host, boolean wildcard, byte[] network, int prefixLength) {
    this.pattern = pattern;
    this.host = host;
    this.wildcard = wildcard;
    this.network = network;
    this.prefixLength = prefixLength;
  }

  public static AllowlistEntry parse(String raw) {
    String p = raw.trim().toLowerCase(Locale.ROOT);
    if (p.isEmpty()) {
      throw new IllegalArgumentException("Empty allowlist entry");
    }
    int slash = p.indexOf('/');
    if (slash > 0) {
      byte[] net = literalBytes(p.substring(0, slash));
      if (net == null) {
        throw new IllegalArgumentException("Invalid CIDR network: " + raw);
      }
      int prefix;
      try {
        prefix = Integer.parseInt(p.substring(slash + 1));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid CIDR prefix: " + raw, e);
      }
      if (prefix < 0 || prefix > net.length * 8) {
        throw new IllegalArgumentException("CIDR prefix out of range: " + raw);
      }
      return new AllowlistEntry(p, null, false, net, prefix);
    }
    byte[] literal = literalBytes(p);
    if (literal != null) {
      return new AllowlistEntry(p, null, false, literal, literal.length * 8);
    }
    if (p.startsWith("*.")) {
      return new AllowlistEntry(p, p.substring(2), true, null, 0);
    }
    return new AllowlistEntry(p, p, false, null, 0);
  }

  public String pattern() {
    return pattern;
  }

  /** Whether the given (lower-cased, unbracketed) host is covered by this entry. */
  public boolean matches(String candidateHost) {
    String h = candidateHost.toLowerCase(Locale.ROOT);
    if (network != null) {
      byte[] addr = literalBytes(h);
      return addr != null && inNetwork(addr);
    }
    if (wildcard) {
      return h.endsWith("." + host);
    }
    return h.equals(host);
  }

  private boolean inNetwork(byte[] addr) {
    if (addr.length != network.length) return false;
    int fullBytes = prefixLength / 8;
    for (int i = 0; i < fullBytes; i++) {
      if (addr[i] != network[i]) return false;
    }
    int remaining = prefixLength % 8;
    if (remaining == 0) return true;
    int mask = (0xff << (8 - remaining)) & 0xff;
    return (addr[fullBytes] & mask) == (network[fullBytes] & mask);
  }

  /** Address bytes of an IP literal, or {@code null} when {@code s} is a host name. */
  static byte[] literalBytes(String s) {
    String v = s.startsWith("[") && s.endsWith("]") ? s.substring(1, s.length() - 1) : s;
    if (!IPV4.matcher(v).matches() && v.indexOf(':') < 0) {
      return null;
    }
    try {
      // literals never trigger a lookup
      return InetAddress.getByName(v).getAddress();
    } catch (UnknownHostException e) {
      return null;
    }
  }

  @Override
  public String toString() {
    return pattern;
  }
}
