package com.libraria.backend.modules.catalog.presentation;

import java.util.List;
import java.util.UUID;

import com.libraria.backend.global.security.JwtAuthenticationPrincipal;
import com.libraria.backend.modules.catalog.application.BookService;
import com.libraria.backend.modules.catalog.domain.BookGenre;
import com.libraria.backend.modules.catalog.domain.BookStatus;
import com.libraria.backend.modules.catalog.presentation.dto.BookListResponse;
import com.libraria.backend.modules.catalog.presentation.dto.BookResponse;
import com.libraria.backend.modules.catalog.presentation.dto.BorrowRequest;
import com.libraria.backend.modules.catalog.presentation.dto.CreateBookRequest;
import com.libraria.backend.modules.catalog.presentation.dto.UpdateBookRequest;
import com.libraria.backend.modules.loan.application.BorrowCoordinator;
import com.libraria.backend.modules.loan.presentation.dto.LoanResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/books")
public class BookController {

    private final BookService bookService;
    private final BorrowCoordinator borrowCoordinator;

    public BookController(BookService bookService, BorrowCoordinator borrowCoordinator) {
        this.bookService = bookService;
        this.borrowCoordinator = borrowCoordinator;
    }

    @GetMapping
    public ResponseEntity<BookListResponse> listBooks(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "genre", required = false) BookGenre genre,
            @RequestParam(name = "status", required = false) BookStatus status,
            @RequestParam(name = "availableOnly", defaultValue = "false") boolean availableOnly,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(bookService.listBooks(search, genre, status, availableOnly, page, size));
    }

    @GetMapping("/popular")
    public ResponseEntity<List<BookResponse>> popularBooks() {
        return ResponseEntity.ok(bookService.popularBooks());
    }

    @GetMapping("/top-rated")
    public ResponseEntity<List<BookResponse>> topRatedBooks() {
        return ResponseEntity.ok(bookService.topRatedBooks());
    }

    @GetMapping("/{bookId}")
    public ResponseEntity<BookResponse> getBook(@PathVariable("bookId") UUID bookId) {
        return ResponseEntity.ok(bookService.getBook(bookId));
    }

    @PostMapping
    public ResponseEntity<BookResponse> createBook(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateBookRequest request
    ) {
        return ResponseEntity.status(201).body(bookService.createBook(request, principal.userId()));
    }

    @Operation(
            summary = "Update a book",
            description = """
                    Partial update. Changing `totalCopies` shifts `availableCopies` by the same delta, \
                    clamped to the new total.
                    """
    )
    @PatchMapping("/{bookId}")
    public ResponseEntity<BookResponse> updateBook(
            @PathVariable("bookId") UUID bookId,
            @Valid @RequestBody UpdateBookRequest request
    ) {
        return ResponseEntity.ok(bookService.updateBook(bookId, request));
    }

    @DeleteMapping("/{bookId}")
    public ResponseEntity<Void> deleteBook(@PathVariable("bookId") UUID bookId) {
        bookService.deleteBook(bookId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Borrow a book", description = "Opens a loan for the caller on one copy of the book.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Loan created"),
            @ApiResponse(responseCode = "409", description = "`BOOK_UNAVAILABLE`, `DUPLICATE_ACTIVE_LOAN` or retryable `CONFLICT`"),
            @ApiResponse(responseCode = "422", description = "`BORROW_LIMIT_EXCEEDED` or `INVALID_DUE_DATE`")
    })
    @PostMapping("/{bookId}/borrow")
    public ResponseEntity<LoanResponse> borrow(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("bookId") UUID bookId,
            @RequestBody(required = false) BorrowRequest request
    ) {
        LoanResponse loan = borrowCoordinator.borrow(
                principal.userId(),
                bookId,
                request != null ? request.dueDate() : null,
                request != null ? request.notes() : null
        );
        return ResponseEntity.status(201).body(loan);
    }
}
