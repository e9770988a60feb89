package com.lsnp.peer.net;

/**
 * What the router did with one datagram.
 */
public enum RouteResult {
    MALFORMED,        // undecodable frame, dropped silently
    ACKNOWLEDGEMENT,  // ACK consumed by the ack registry
    SPOOFED,          // identity does not match the UDP source
    UNAUTHORIZED,     // token failed validation
    DUPLICATE,        // already seen; re-ACKed if reliable
    REVOCATION,       // REVOKE applied
    DISPATCHED,
    UNHANDLED         // accepted, but no handler registered
}
