package com.librarycatalog.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class AuthorTest {

    @Test
    @DisplayName("full name joins first and last name")
    void fullName_shouldJoinNames() {
        Author author = new Author();
        author.setFirstName("Joshua");
        author.setLastName("Bloch");

        assertThat(author.fullName()).isEqualTo("Joshua Bloch");
    }

    @Test
    @DisplayName("full name of an author without last name is just the first name")
    void fullName_shouldOmitMissingLastName() {
        Author author = new Author();
        author.setFirstName("Joshua");

        assertThat(author.fullName()).isEqualTo("Joshua");
    }
}
