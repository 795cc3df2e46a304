package com.librarycatalog.controller;

import com.librarycatalog.config.OpenApiConfig;
import com.librarycatalog.dto.AuthorRequestDTO;
import com.librarycatalog.model.Author;
import com.librarycatalog.security.RequireActive;
import com.librarycatalog.service.AuthorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/authors")
@RequiredArgsConstructor
@Tag(name = "Authors")
public class AuthorController {

    private final AuthorService authorService;

    @GetMapping
    @Operation(summary = "List all authors")
    public ResponseEntity<Map<String, Object>> getAllAuthors() {
        List<Author> authors = authorService.getAllAuthors();
        return ResponseEntity.ok(Map.of("success", true, "count", authors.size(), "data", authors));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an author by id")
    public ResponseEntity<Map<String, Object>> getAuthorById(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("success", true, "data", authorService.getAuthorById(id)));
    }

    @PostMapping
    @RequireActive
    @Operation(summary = "Create an author", security = @SecurityRequirement(name = OpenApiConfig.SESSION_AUTH))
    public ResponseEntity<Map<String, Object>> createAuthor(@Valid @RequestBody AuthorRequestDTO body) {
        Author created = authorService.createAuthor(body);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("success", true, "message", "Author created successfully", "data", created));
    }

    @PutMapping("/{id}")
    @RequireActive
    @Operation(summary = "Update an author", security = @SecurityRequirement(name = OpenApiConfig.SESSION_AUTH))
    public ResponseEntity<Map<String, Object>> updateAuthor(@PathVariable Long id,
            @Valid @RequestBody AuthorRequestDTO body) {
        Author updated = authorService.updateAuthor(id, body);
        return ResponseEntity.ok(Map.of("success", true, "message", "Author updated successfully", "data", updated));
    }

    @DeleteMapping("/{id}")
    @RequireActive
    @Operation(summary = "Delete an author", security = @SecurityRequirement(name = OpenApiConfig.SESSION_AUTH))
    public ResponseEntity<Map<String, Object>> deleteAuthor(@PathVariable Long id) {
        Author deleted = authorService.deleteAuthor(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Author deleted successfully", "data", deleted));
    }
}
