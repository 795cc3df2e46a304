package com.librarycatalog.service;

import com.librarycatalog.dto.AuthorRequestDTO;
import com.librarycatalog.exception.ResourceConflictException;
import com.librarycatalog.exception.ResourceNotFoundException;
import com.librarycatalog.model.Author;
import com.librarycatalog.repo.AuthorRepository;
import com.librarycatalog.repo.BookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorService {

    private final AuthorRepository authorRepository;
    private final BookRepository bookRepository;

    @Transactional(readOnly = true)
    public List<Author> getAllAuthors() {
        return authorRepository.findAll();
    }

    @Transactional(readOnly = true)
    public Author getAuthorById(Long id) {
        return authorRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Author", id));
    }

    @Transactional
    public Author createAuthor(AuthorRequestDTO request) {
        if (authorRepository.existsByEmail(request.getEmail())) {
            throw new ResourceConflictException("Author with this email already exists");
        }
        Author saved = authorRepository.save(request.toModel());
        log.info("Created author {}", saved.getId());
        return saved;
    }

    @Transactional
    public Author updateAuthor(Long id, AuthorRequestDTO request) {
        Author author = getAuthorById(id);
        if (authorRepository.existsByEmailAndIdNot(request.getEmail(), id)) {
            throw new ResourceConflictException("Email already exists for another author");
        }
        request.applyTo(author);
        return authorRepository.save(author);
    }

    /**
     * Refuses while any book names this author. Books reference authors by
     * free text, so the match is on "first last" or the email.
     */
    @Transactional
    public Author deleteAuthor(Long id) {
        Author author = getAuthorById(id);
        // TODO: switch to an author_id foreign key on books once the catalog API accepts author ids
        if (bookRepository.existsByAuthorIn(List.of(author.fullName(), author.getEmail()))) {
            throw new ResourceConflictException("Cannot delete author. Author has associated books.");
        }
        authorRepository.delete(author);
        log.info("Deleted author {}", id);
        return author;
    }
}
