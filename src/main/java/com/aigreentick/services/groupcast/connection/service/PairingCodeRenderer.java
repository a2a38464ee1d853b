package com.aigreentick.services.groupcast.connection.service;

/**
 * Turns a raw pairing challenge into what the operator UI displays.
 */
@FunctionalInterface
public interface PairingCodeRenderer {

    String render(String pairingCode);
}
