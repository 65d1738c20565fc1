package com.yoursp.botdetection.modules.network;

import jakarta.servlet.http.HttpServletRequest;

import java.net.InetAddress;
import java.util.Optional;

/**
 * Finds the best-effort true client address of a request, looking through
 * reverse-proxy headers.
 */
public interface RealIpExtractor {

    Optional<InetAddress> extract(HttpServletRequest request);
}
