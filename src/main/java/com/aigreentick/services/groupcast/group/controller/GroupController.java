package com.aigreentick.services.groupcast.group.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.groupcast.common.dto.ResponseMessage;
import com.aigreentick.services.groupcast.group.model.Group;
import com.aigreentick.services.groupcast.group.service.GroupDirectoryService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupController {

    private final GroupDirectoryService groupDirectoryService;

    @GetMapping
    public ResponseEntity<List<Group>> listGroups() {
        return ResponseEntity.ok(groupDirectoryService.list());
    }

    @PostMapping("/refresh")
    public ResponseEntity<ResponseMessage<List<Group>>> refreshGroups() {
        List<Group> groups = groupDirectoryService.refresh();
        return ResponseEntity.ok(ResponseMessage.success(groups.size() + " groups loaded", groups));
    }
}
