package com.programmersdiary.cronwarden.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthcheckController {

    @GetMapping("/healthcheck")
    public Map<String, String> status() {
        return Map.of("status", "OK");
    }
}
