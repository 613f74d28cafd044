package com.libraria.backend.modules.catalog.application;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.catalog.domain.BookAvailability;
import com.libraria.backend.modules.catalog.domain.BookGenre;
import com.libraria.backend.modules.catalog.domain.BookStatus;
import com.libraria.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.libraria.backend.modules.catalog.presentation.dto.BookListResponse;
import com.libraria.backend.modules.catalog.presentation.dto.BookResponse;
import com.libraria.backend.modules.catalog.presentation.dto.CreateBookRequest;
import com.libraria.backend.modules.catalog.presentation.dto.UpdateBookRequest;
import com.libraria.backend.modules.loan.infrastructure.persistence.LoanRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);
    private static final int MAX_PAGE_SIZE = 100;
    private static final String DEFAULT_LANGUAGE = "English";

    private final BookRepository bookRepository;
    private final LoanRepository loanRepository;
    private final LibraryUserRepository userRepository;

    public BookService(
            BookRepository bookRepository,
            LoanRepository loanRepository,
            LibraryUserRepository userRepository
    ) {
        this.bookRepository = bookRepository;
        this.loanRepository = loanRepository;
        this.userRepository = userRepository;
    }

    @Transactional(readOnly = true)
    public BookListResponse listBooks(
            String search,
            BookGenre genre,
            BookStatus status,
            boolean availableOnly,
            int page,
            int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        String pattern = StringUtils.hasText(search)
                ? "%" + search.trim().toLowerCase(Locale.ROOT) + "%"
                : null;
        Page<Book> result = bookRepository.search(genre, status, availableOnly, pattern, PageRequest.of(safePage, safeSize));
        return new BookListResponse(
                result.getContent().stream().map(BookResponse::from).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                result.getTotalPages()
        );
    }

    @Transactional(readOnly = true)
    public BookResponse getBook(UUID bookId) {
        return BookResponse.from(loadBook(bookId));
    }

    @Transactional(readOnly = true)
    public List<BookResponse> popularBooks() {
        return bookRepository.findTop10ByOrderByTimesBorrowedDescTitleAsc().stream()
                .map(BookResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<BookResponse> topRatedBooks() {
        return bookRepository.findTop10ByTotalRatingsGreaterThanOrderByAverageRatingDescTotalRatingsDesc(0).stream()
                .map(BookResponse::from)
                .toList();
    }

    public BookResponse createBook(CreateBookRequest request, UUID librarianId) {
        String isbn = request.isbn().trim();
        if (bookRepository.existsByIsbn(isbn)) {
            throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.DUPLICATE_ISBN);
        }
        int totalCopies = request.totalCopies();
        int availableCopies = request.availableCopies() != null ? request.availableCopies() : totalCopies;
        if (availableCopies < 0 || availableCopies > totalCopies) {
            throw new ProblemException(
                    HttpStatus.UNPROCESSABLE_ENTITY,
                    ProblemCodes.CAPACITY_VIOLATION,
                    "availableCopies must be between 0 and totalCopies"
            );
        }

        Book book = new Book();
        book.setTitle(request.title().trim());
        book.setAuthor(request.author().trim());
        book.setIsbn(isbn);
        book.setPublisher(request.publisher().trim());
        book.setPublicationDate(request.publicationDate());
        book.setGenre(request.genre());
        book.setPages(request.pages());
        book.setLanguage(StringUtils.hasText(request.language()) ? request.language().trim() : DEFAULT_LANGUAGE);
        book.setEdition(trimToNull(request.edition()));
        book.setDescription(trimToNull(request.description()));
        book.setShelfLocation(trimToNull(request.shelfLocation()));
        book.setStatus(BookStatus.AVAILABLE);
        book.setTotalCopies(totalCopies);
        book.setAvailableCopies(availableCopies);
        BookAvailability.reconcileStatus(book);
        if (librarianId != null) {
            userRepository.findById(librarianId).ifPresent(book::setAddedBy);
        }

        Book saved = bookRepository.save(book);
        log.info("Book {} added with {} of {} copies available", saved.getId(), availableCopies, totalCopies);
        return BookResponse.from(saved);
    }

    public BookResponse updateBook(UUID bookId, UpdateBookRequest request) {
        Book book = bookRepository.findByIdForUpdate(bookId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.BOOK_NOT_FOUND));

        if (request.isbn() != null) {
            String isbn = request.isbn().trim();
            if (!isbn.equals(book.getIsbn()) && bookRepository.existsByIsbnAndIdNot(isbn, bookId)) {
                throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.DUPLICATE_ISBN);
            }
            book.setIsbn(isbn);
        }
        if (request.title() != null) {
            book.setTitle(request.title().trim());
        }
        if (request.author() != null) {
            book.setAuthor(request.author().trim());
        }
        if (request.publisher() != null) {
            book.setPublisher(request.publisher().trim());
        }
        if (request.publicationDate() != null) {
            book.setPublicationDate(request.publicationDate());
        }
        if (request.genre() != null) {
            book.setGenre(request.genre());
        }
        if (request.pages() != null) {
            book.setPages(request.pages());
        }
        if (request.language() != null) {
            book.setLanguage(request.language().trim());
        }
        if (request.edition() != null) {
            book.setEdition(trimToNull(request.edition()));
        }
        if (request.description() != null) {
            book.setDescription(trimToNull(request.description()));
        }
        if (request.shelfLocation() != null) {
            book.setShelfLocation(trimToNull(request.shelfLocation()));
        }
        if (request.status() != null) {
            book.setStatus(request.status());
        }
        if (request.totalCopies() != null && request.totalCopies() != book.getTotalCopies()) {
            int oldTotal = book.getTotalCopies();
            BookAvailability.adjustForCapacityChange(book, oldTotal, request.totalCopies());
            log.info("Book {} capacity changed from {} to {}, available now {}",
                    bookId, oldTotal, book.getTotalCopies(), book.getAvailableCopies());
        } else {
            BookAvailability.reconcileStatus(book);
        }
        return BookResponse.from(book);
    }

    public void deleteBook(UUID bookId) {
        Book book = loadBook(bookId);
        if (loanRepository.existsByBookId(bookId)) {
            throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.BOOK_HAS_LOANS,
                    "Book has loan history and cannot be deleted");
        }
        bookRepository.delete(book);
        log.info("Book {} deleted", bookId);
    }

    private Book loadBook(UUID bookId) {
        return bookRepository.findById(bookId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.BOOK_NOT_FOUND));
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
