package com.aigreentick.services.groupcast.transport.service.impl;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.aigreentick.services.groupcast.group.model.Group;
import com.aigreentick.services.groupcast.transport.dto.GatewayGroupList;
import com.aigreentick.services.groupcast.transport.dto.GatewaySessionEvent;
import com.aigreentick.services.groupcast.transport.dto.StateEvent;
import com.aigreentick.services.groupcast.transport.enums.DisconnectReason;
import com.aigreentick.services.groupcast.transport.enums.SessionEventType;

class GatewayMessagingTransportTest {

    @Test
    void qrUpdateBecomesPairingCode() {
        List<StateEvent> events = GatewayMessagingTransport.toStateEvents(
                GatewaySessionEvent.builder().qr("2@abc").build());

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.getType()).isEqualTo(SessionEventType.PAIRING_CODE);
            assertThat(e.getPairingCode()).isEqualTo("2@abc");
        });
    }

    @Test
    void closeCarriesMappedReason() {
        List<StateEvent> events = GatewayMessagingTransport.toStateEvents(
                GatewaySessionEvent.builder().connection("close").statusCode(401).build());

        assertThat(events).containsExactly(StateEvent.closed(DisconnectReason.LOGGED_OUT));
    }

    @Test
    void unknownConnectionValueIsIgnored() {
        assertThat(GatewayMessagingTransport.toStateEvents(
                GatewaySessionEvent.builder().connection("syncing").build())).isEmpty();
    }

    @Test
    void groupsUpdateCarriesCount() {
        assertThat(GatewayMessagingTransport.toStateEvents(GatewaySessionEvent.builder().groupsUpdated(3).build()))
                .containsExactly(StateEvent.groupsUpdated(3));
    }

    @Test
    void groupMetadataIsMapped() {
        GatewayGroupList.GatewayGroup raw = new GatewayGroupList.GatewayGroup(
                "123@g.us",
                "Family",
                null,
                1_700_000_000L,
                List.of(new GatewayGroupList.Participant("me@s.whatsapp.net", "superadmin"),
                        new GatewayGroupList.Participant("other@s.whatsapp.net", null)));

        Group group = GatewayMessagingTransport.toGroup(raw, "me@s.whatsapp.net");

        assertThat(group.getId()).isEqualTo("123@g.us");
        assertThat(group.getName()).isEqualTo("Family");
        assertThat(group.getParticipantsCount()).isEqualTo(2);
        assertThat(group.isAdmin()).isTrue();
        assertThat(group.getDescription()).isEmpty();
        assertThat(group.getCreatedAt()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
    }

    @Test
    void groupWithoutSubjectGetsPlaceholderName() {
        GatewayGroupList.GatewayGroup raw = new GatewayGroupList.GatewayGroup("9@g.us", " ", "desc", null, null);

        Group group = GatewayMessagingTransport.toGroup(raw, "me@s.whatsapp.net");

        assertThat(group.getName()).isEqualTo("Unnamed group");
        assertThat(group.isAdmin()).isFalse();
        assertThat(group.getParticipantsCount()).isZero();
        assertThat(group.getCreatedAt()).isNull();
    }
}
