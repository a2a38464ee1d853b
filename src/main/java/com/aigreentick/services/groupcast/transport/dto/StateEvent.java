package com.aigreentick.services.groupcast.transport.dto;

import com.aigreentick.services.groupcast.transport.enums.DisconnectReason;
import com.aigreentick.services.groupcast.transport.enums.SessionEventType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A session state change reported by the transport.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateEvent {

    private SessionEventType type;

    private String pairingCode; // PAIRING_CODE only

    private DisconnectReason closeReason; // CLOSE only

    private String message; // ERROR detail, optional otherwise

    public static StateEvent connecting() {
        return StateEvent.builder().type(SessionEventType.CONNECTING).build();
    }

    public static StateEvent pairingCode(String code) {
        return StateEvent.builder().type(SessionEventType.PAIRING_CODE).pairingCode(code).build();
    }

    public static StateEvent open() {
        return StateEvent.builder().type(SessionEventType.OPEN).build();
    }

    public static StateEvent closed(DisconnectReason reason) {
        return StateEvent.builder().type(SessionEventType.CLOSE).closeReason(reason).build();
    }

    public static StateEvent error(String message) {
        return StateEvent.builder().type(SessionEventType.ERROR).message(message).build();
    }

    public static StateEvent groupsUpdated(int count) {
        return StateEvent.builder().type(SessionEventType.GROUPS_UPDATED).message(String.valueOf(count)).build();
    }
}
