package com.librarycatalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.librarycatalog.model.Book;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookRequestDTO {

    @NotBlank(message = "Title is required")
    private String title;

    @NotBlank(message = "Author is required")
    private String author;

    @NotBlank(message = "ISBN is required")
    private String isbn;

    @NotNull(message = "Published date is required")
    private LocalDate publishedDate;

    @NotBlank(message = "Genre is required")
    private String genre;

    @NotNull(message = "Pages must be a positive number")
    @Positive(message = "Pages must be a positive number")
    private Integer pages;

    @NotBlank(message = "Publisher is required")
    private String publisher;

    @Pattern(regexp = ".*\\S.*", message = "Language cannot be empty if provided")
    private String language;

    private String description;

    @PositiveOrZero(message = "Available copies must be a non-negative number")
    private Integer availableCopies;

    @Positive(message = "Total copies must be a positive number")
    private Integer totalCopies;

    /** ISBN-10 or ISBN-13, hyphens and spaces ignored. */
    @JsonIgnore
    @AssertTrue(message = "Invalid ISBN format")
    public boolean isIsbnFormatValid() {
        return isbn == null || isbn.isBlank() || isbn.replaceAll("[-\\s]", "").matches("\\d{10}|\\d{13}");
    }

    public Book toModel() {
        Book book = new Book();
        applyTo(book);
        return book;
    }

    public void applyTo(Book book) {
        book.setTitle(title);
        book.setAuthor(author);
        book.setIsbn(isbn);
        book.setPublishedDate(publishedDate);
        book.setGenre(genre);
        book.setPages(pages);
        book.setPublisher(publisher);
        book.setLanguage(language);
        book.setDescription(description);
        book.setAvailableCopies(availableCopies != null ? availableCopies : 1);
        book.setTotalCopies(totalCopies != null ? totalCopies : 1);
    }
}
