package com.aigreentick.services.groupcast.connection.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionState {

    DISCONNECTED("disconnected"),
    CONNECTING("connecting"),
    QR_READY("qr_ready"),
    CONNECTED("connected"),
    ERROR("error");

    private final String value;

    ConnectionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
