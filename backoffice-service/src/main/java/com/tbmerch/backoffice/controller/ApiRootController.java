package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.config.BackofficeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ApiRootController {

    private final BackofficeProperties properties;

    @GetMapping("/api")
    public Banner root() {
        return new Banner("Dropshipping back-office API", properties.getVersion());
    }

    public record Banner(String message, String version) {}
}
