package com.gentoro.reportbatch.security;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** Name resolution seam, so address checks can be exercised without DNS. */
@FunctionalInterface
public interface HostResolver {
  HostResolver SYSTEM = InetAddress::getAllByName;

  InetAddress[] resolve(String host) throws UnknownHostException;
}
