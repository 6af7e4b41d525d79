package com.gentoro.reportbatch.security;

import com.gentoro.reportbatch.exception.AllowlistDeniedException;
import com.gentoro.reportbatch.exception.ValidationException;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Decides whether an endpoint designator may be contacted.
 *
 * <p>Rules, in order:
 *
 * <ol>
 *   <li>a relative designator is permitted and resolved against the configured base URL;
 *   <li>an absolute designator is denied when no allowlist is configured;
 *   <li>otherwise its host must match an allowlist entry;
 *   <li>whatever the outcome above, a destination that is loopback, link-local or private is
 *       denied. Allowlist membership does not override this.
 * </ol>
 */
public final class AllowlistValidator {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(AllowlistValidator.class);

  private final String baseUrl;
  private final List<AllowlistEntry> entries;
  private final HostResolver resolver;

  public AllowlistValidator(String baseUrl, List<String> allowlist) {
    this(baseUrl, allowlist, HostResolver.SYSTEM);
  }

  public AllowlistValidator(String baseUrl, List<String> allowlist, HostResolver resolver) {
    this.baseUrl = StringUtils.trimToEmpty(baseUrl);
    this.entries = allowlist == null ? List.of() : allowlist.stream().map(AllowlistEntry::parse).toList();
    this.resolver = resolver;
  }

  public boolean hasAllowlist() {
    return !entries.isEmpty();
  }

  /** Evaluate a designator without throwing for denials. */
  public EndpointDecision evaluate(String designator) {
    if (StringUtils.isBlank(designator)) {
      throw new ValidationException("Endpoint is required");
    }
    String candidate = designator.trim();
    URI uri = parse(candidate);

    String resolved;
    if (uri.isAbsolute()) {
      if (!hasAllowlist()) {
        return EndpointDecision.deny(
            DenyReason.NO_ALLOWLIST_CONFIGURED,
            "Absolute endpoint URLs require an upstream allowlist");
      }
      String host = hostOf(uri);
      if (entries.stream().noneMatch(e -> e.matches(host))) {
        return EndpointDecision.deny(
            DenyReason.NOT_ALLOWLISTED, "Host '%s' is not allowlisted".formatted(host));
      }
      resolved = candidate;
    } else {
      if (baseUrl.isEmpty()) {
        throw new ValidationException(
            "Relative endpoint '%s' requires a configured upstream base URL".formatted(candidate));
      }
      resolved = join(baseUrl, candidate);
    }

    String host = hostOf(parse(resolved));
    if (isPrivateDestination(host)) {
      return EndpointDecision.deny(
          DenyReason.PRIVATE_ADDRESS_BLOCKED,
          "Destination '%s' is a loopback, link-local or private address".formatted(host));
    }
    return EndpointDecision.permit(resolved);
  }

  /** Resolve a designator to an absolute URL, throwing {@link AllowlistDeniedException}. */
  public String requirePermitted(String designator) {
    EndpointDecision decision = evaluate(designator);
    if (!decision.isPermitted()) {
      log.warn("Endpoint '{}' denied: {}", designator, decision.denyReason());
      throw new AllowlistDeniedException(decision.denyReason(), decision.message());
    }
    return decision.url();
  }

  private boolean isPrivateDestination(String host) {
    if ("localhost".equals(host) || host.endsWith(".localhost")) {
      return true;
    }
    byte[] literal = AllowlistEntry.literalBytes(host);
    try {
      InetAddress[] addresses =
          literal != null
              ? new InetAddress[] {InetAddress.getByAddress(literal)}
              : resolver.resolve(host);
      for (InetAddress address : addresses) {
        if (isPrivate(address)) return true;
      }
      return false;
    } catch (UnknownHostException e) {
      // no address to contact; the call itself will fail as a connection error
      log.debug("Could not resolve host {}: {}", host, e.getMessage());
      return false;
    }
  }

  static boolean isPrivate(InetAddress address) {
    if (address.isLoopbackAddress()
        || address.isLinkLocalAddress()
        || address.isSiteLocalAddress()
        || address.isAnyLocalAddress()) {
      return true;
    }
    byte[] b = address.getAddress();
    if (address instanceof Inet6Address) {
      // fc00::/7 unique local
      return (b[0] & 0xfe) == 0xfc;
    }
    // 100.64.0.0/10 shared address space
    return (b[0] & 0xff) == 100 && (b[1] & 0xc0) == 64;
  }

  private static URI parse(String value) {
    try {
      return new URI(value);
    } catch (URISyntaxException e) {
      throw new ValidationException("Malformed endpoint: " + value);
    }
  }

  private static String hostOf(URI uri) {
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new ValidationException("Unsupported endpoint scheme: " + uri.getScheme());
    }
    String host = uri.getHost();
    if (StringUtils.isBlank(host)) {
      throw new ValidationException("Endpoint has no host: " + uri);
    }
    host = host.toLowerCase(Locale.ROOT);
    if (host.startsWith("[") && host.endsWith("]")) {
      host = host.substring(1, host.length() - 1);
    }
    return host;
  }

  private static String join(String base, String path) {
    return StringUtils.removeEnd(base, "/") + "/" + StringUtils.removeStart(path, "/");
  }
}
