package com.librarycatalog.controller;

import com.librarycatalog.config.OpenApiConfig;
import com.librarycatalog.dto.BookRequestDTO;
import com.librarycatalog.model.Book;
import com.librarycatalog.security.RequireActive;
import com.librarycatalog.service.BookService;
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
@RequestMapping("/api/books")
@RequiredArgsConstructor
@Tag(name = "Books")
public class BookController {

    private final BookService bookService;

    @GetMapping
    @Operation(summary = "List all books")
    public ResponseEntity<Map<String, Object>> getAllBooks() {
        List<Book> books = bookService.getAllBooks();
        return ResponseEntity.ok(Map.of("success", true, "count", books.size(), "data", books));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a book by id")
    public ResponseEntity<Map<String, Object>> getBookById(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("success", true, "data", bookService.getBookById(id)));
        // unknown id surfaces as 404 via GlobalExceptionHandler
    }

    @PostMapping
    @RequireActive
    @Operation(summary = "Create a book", security = @SecurityRequirement(name = OpenApiConfig.SESSION_AUTH))
    public ResponseEntity<Map<String, Object>> createBook(@Valid @RequestBody BookRequestDTO body) {
        Book created = bookService.createBook(body);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("success", true, "message", "Book created successfully", "data", created));
    }

    @PutMapping("/{id}")
    @RequireActive
    @Operation(summary = "Update a book", security = @SecurityRequirement(name = OpenApiConfig.SESSION_AUTH))
    public ResponseEntity<Map<String, Object>> updateBook(@PathVariable Long id,
            @Valid @RequestBody BookRequestDTO body) {
        Book updated = bookService.updateBook(id, body);
        return ResponseEntity.ok(Map.of("success", true, "message", "Book updated successfully", "data", updated));
    }

    @DeleteMapping("/{id}")
    @RequireActive
    @Operation(summary = "Delete a book", security = @SecurityRequirement(name = OpenApiConfig.SESSION_AUTH))
    public ResponseEntity<Map<String, Object>> deleteBook(@PathVariable Long id) {
        Book deleted = bookService.deleteBook(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Book deleted successfully", "data", deleted));
    }
}
