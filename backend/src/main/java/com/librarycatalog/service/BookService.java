package com.librarycatalog.service;

import com.librarycatalog.dto.BookRequestDTO;
import com.librarycatalog.exception.ResourceConflictException;
import com.librarycatalog.exception.ResourceNotFoundException;
import com.librarycatalog.model.Book;
import com.librarycatalog.repo.BookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookService {

    private final BookRepository bookRepository;

    @Transactional(readOnly = true)
    public List<Book> getAllBooks() {
        return bookRepository.findAll();
    }

    @Transactional(readOnly = true)
    public Book getBookById(Long id) {
        return bookRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Book", id));
    }

    @Transactional
    public Book createBook(BookRequestDTO request) {
        if (bookRepository.existsByIsbn(request.getIsbn())) {
            throw new ResourceConflictException("Book with this ISBN already exists");
        }
        Book saved = bookRepository.save(request.toModel());
        log.info("Created book {} ({})", saved.getId(), saved.getIsbn());
        return saved;
    }

    @Transactional
    public Book updateBook(Long id, BookRequestDTO request) {
        Book book = getBookById(id);
        if (bookRepository.existsByIsbnAndIdNot(request.getIsbn(), id)) {
            throw new ResourceConflictException("ISBN already exists for another book");
        }
        request.applyTo(book);
        return bookRepository.save(book);
    }

    @Transactional
    public Book deleteBook(Long id) {
        Book book = getBookById(id);
        bookRepository.delete(book);
        log.info("Deleted book {}", id);
        return book;
    }
}
