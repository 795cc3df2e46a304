package com.librarycatalog.dto;

import com.librarycatalog.model.Author;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthorRequestDTO {

    @NotBlank(message = "First name is required")
    @Size(max = 50, message = "First name must be at most 50 characters")
    private String firstName;

    @Size(max = 50, message = "Last name must be at most 50 characters")
    private String lastName;

    @NotBlank(message = "Email is required")
    @Pattern(regexp = "^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$", message = "Invalid email format")
    private String email;

    @NotNull(message = "Birth date is required")
    private LocalDate birthDate;

    @NotBlank(message = "Nationality is required")
    private String nationality;

    @Size(max = 1000, message = "Biography must be at most 1000 characters")
    private String biography;

    @URL(message = "Invalid website URL format")
    private String website;

    public Author toModel() {
        Author author = new Author();
        applyTo(author);
        return author;
    }

    public void applyTo(Author author) {
        author.setFirstName(firstName);
        author.setLastName(lastName);
        author.setEmail(email);
        author.setBirthDate(birthDate);
        author.setNationality(nationality);
        author.setBiography(biography);
        author.setWebsite(website);
    }
}
