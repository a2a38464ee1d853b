package com.aigreentick.services.groupcast.settings.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.groupcast.common.dto.ResponseMessage;
import com.aigreentick.services.groupcast.settings.model.Settings;
import com.aigreentick.services.groupcast.settings.service.SettingsService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;

    @GetMapping
    public ResponseEntity<Settings> getSettings() {
        return ResponseEntity.ok(settingsService.current());
    }

    @PutMapping
    public ResponseEntity<ResponseMessage<Settings>> updateSettings(@Valid @RequestBody Settings settings) {
        return ResponseEntity.ok(ResponseMessage.success("Settings saved", settingsService.update(settings)));
    }
}
