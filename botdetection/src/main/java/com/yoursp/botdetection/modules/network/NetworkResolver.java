package com.yoursp.botdetection.modules.network;

import java.net.InetAddress;

/**
 * Maps a client address to the network it is tracked by.
 */
public interface NetworkResolver {

    ClientNetwork resolve(InetAddress clientAddress);
}
