package com.librarycatalog.controller;

import com.librarycatalog.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class IndexController {

    private final AuthProperties authProperties;

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> index() {
        return ResponseEntity.ok(Map.of(
                "message", "Welcome to Library Management API with OAuth Authentication",
                "documentation", "/api-docs",
                "authentication", Map.of(
                        "login", authProperties.getLoginPath(),
                        "logout", "/auth/logout",
                        "status", "/auth/status",
                        "dashboard", "/auth/dashboard"),
                "endpoints", Map.of(
                        "books", "/api/books",
                        "authors", "/api/authors"),
                "note", "POST, PUT, and DELETE operations require authentication"));
    }
}
