package com.aigreentick.services.groupcast.connection.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.groupcast.common.dto.ResponseMessage;
import com.aigreentick.services.groupcast.connection.dto.ConnectionStatus;
import com.aigreentick.services.groupcast.connection.service.ConnectionManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/connection")
@RequiredArgsConstructor
public class ConnectionController {

    private final ConnectionManager connectionManager;

    @GetMapping("/status")
    public ResponseEntity<ConnectionStatus> status() {
        return ResponseEntity.ok(connectionManager.status());
    }

    @PostMapping("/connect")
    public ResponseEntity<ResponseMessage<ConnectionStatus>> connect() {
        log.info("Connect requested by operator");
        boolean started = connectionManager.connect();
        String message = started
                ? "Connection started"
                : "Already " + connectionManager.getState().getValue();
        return ResponseEntity.ok(ResponseMessage.success(message, connectionManager.status()));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<ResponseMessage<ConnectionStatus>> disconnect() {
        log.info("Disconnect requested by operator");
        connectionManager.disconnect();
        return ResponseEntity.ok(ResponseMessage.success("Disconnected", connectionManager.status()));
    }
}
