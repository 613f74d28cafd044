package com.libraria.backend.modules.rating.application;

import java.util.UUID;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.global.security.JwtAuthenticationPrincipal;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.libraria.backend.modules.rating.domain.BookRating;
import com.libraria.backend.modules.rating.infrastructure.persistence.BookRatingRepository;
import com.libraria.backend.modules.rating.presentation.dto.RateBookRequest;
import com.libraria.backend.modules.rating.presentation.dto.RateBookResponse;
import com.libraria.backend.modules.rating.presentation.dto.RatingListResponse;
import com.libraria.backend.modules.rating.presentation.dto.RatingResponse;
import com.libraria.backend.modules.rating.presentation.dto.UpdateRatingRequest;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class BookRatingService {

    private static final int MAX_PAGE_SIZE = 100;

    private final BookRatingRepository ratingRepository;
    private final BookRepository bookRepository;
    private final LibraryUserRepository userRepository;
    private final RatingAggregator ratingAggregator;

    public BookRatingService(
            BookRatingRepository ratingRepository,
            BookRepository bookRepository,
            LibraryUserRepository userRepository,
            RatingAggregator ratingAggregator
    ) {
        this.ratingRepository = ratingRepository;
        this.bookRepository = bookRepository;
        this.userRepository = userRepository;
        this.ratingAggregator = ratingAggregator;
    }

    /**
     * Creates the caller's rating of the book, or replaces it when one exists.
     */
    public RateBookResponse rate(UUID userId, UUID bookId, RateBookRequest request) {
        Book book = lockBook(bookId);
        LibraryUser user = userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.USER_NOT_FOUND));

        BookRating rating = ratingRepository.findByUserIdAndBookId(userId, bookId).orElse(null);
        boolean created = rating == null;
        if (created) {
            rating = ratingRepository.save(new BookRating(user, book, request.rating(), trimToNull(request.review())));
        } else {
            rating.setRating(request.rating());
            rating.setReview(trimToNull(request.review()));
        }

        ratingAggregator.recomputeAverage(book);
        return new RateBookResponse(created, RatingResponse.from(rating), book.getAverageRating(), book.getTotalRatings());
    }

    public RatingResponse updateRating(UUID ratingId, UpdateRatingRequest request, JwtAuthenticationPrincipal principal) {
        BookRating rating = loadRating(ratingId);
        if (!rating.getUser().getId().equals(principal.userId())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, ProblemCodes.FORBIDDEN, "Only the author can edit a rating");
        }
        Book book = lockBook(rating.getBook().getId());
        if (request.rating() != null) {
            rating.setRating(request.rating());
        }
        if (request.review() != null) {
            rating.setReview(trimToNull(request.review()));
        }
        ratingAggregator.recomputeAverage(book);
        return RatingResponse.from(rating);
    }

    public void deleteRating(UUID ratingId, JwtAuthenticationPrincipal principal) {
        BookRating rating = loadRating(ratingId);
        if (!principal.isLibrarian() && !rating.getUser().getId().equals(principal.userId())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, ProblemCodes.FORBIDDEN, "Only the author can delete a rating");
        }
        Book book = lockBook(rating.getBook().getId());
        ratingRepository.delete(rating);
        ratingAggregator.recomputeAverage(book);
    }

    @Transactional(readOnly = true)
    public RatingListResponse listRatingsForBook(UUID bookId, int page, int size) {
        if (!bookRepository.existsById(bookId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.BOOK_NOT_FOUND);
        }
        return toList(ratingRepository.findByBookIdOrderByCreatedAtDesc(bookId, pageable(page, size)));
    }

    @Transactional(readOnly = true)
    public RatingListResponse listRatings(JwtAuthenticationPrincipal principal, int page, int size) {
        Page<BookRating> result = principal.isLibrarian()
                ? ratingRepository.findAllByOrderByCreatedAtDesc(pageable(page, size))
                : ratingRepository.findByUserIdOrderByCreatedAtDesc(principal.userId(), pageable(page, size));
        return toList(result);
    }

    private Book lockBook(UUID bookId) {
        return bookRepository.findByIdForUpdate(bookId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.BOOK_NOT_FOUND));
    }

    private BookRating loadRating(UUID ratingId) {
        return ratingRepository.findById(ratingId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.RATING_NOT_FOUND));
    }

    private static Pageable pageable(int page, int size) {
        return PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
    }

    private static RatingListResponse toList(Page<BookRating> result) {
        return new RatingListResponse(
                result.getContent().stream().map(RatingResponse::from).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                result.getTotalPages()
        );
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
