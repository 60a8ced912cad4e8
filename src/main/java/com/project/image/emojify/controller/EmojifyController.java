package com.project.image.emojify.controller;

import com.project.image.emojify.DTOs.EmojifyResult;
import com.project.image.emojify.service.EmojifyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EmojifyController {
    private static final Logger log = LoggerFactory.getLogger(EmojifyController.class);

    private final EmojifyService emojifyService;

    public EmojifyController(EmojifyService emojifyService) {
        this.emojifyService = emojifyService;
    }

    // objectName is optional at the HTTP level so that a missing parameter gets error 106.
    @GetMapping("/emojify")
    public ResponseEntity<EmojifyResult> emojify(@RequestParam(name = "objectName", required = false) String objectName) {
        log.debug("GET /emojify objectName={}", objectName);
        EmojifyResult result = emojifyService.emojify(objectName);
        return ResponseEntity.status(result.statusCode()).body(result);
    }
}
