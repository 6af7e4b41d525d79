package com.gentoro.reportbatch.upstream;

import com.gentoro.reportbatch.exception.UpstreamException;

/** Executes a single call against the upstream report service. */
public interface UpstreamClient {

  /**
   * @return the parsed response of a 2xx call
   * @throws UpstreamException on timeout, connection failure, I/O error or non-2xx status
   */
  UpstreamResponse execute(UpstreamRequest request) throws UpstreamException;
}
