package com.libraria.backend.modules.rating.presentation;

import java.util.UUID;

import com.libraria.backend.global.security.JwtAuthenticationPrincipal;
import com.libraria.backend.modules.rating.application.BookRatingService;
import com.libraria.backend.modules.rating.presentation.dto.RateBookRequest;
import com.libraria.backend.modules.rating.presentation.dto.RateBookResponse;
import com.libraria.backend.modules.rating.presentation.dto.RatingListResponse;
import com.libraria.backend.modules.rating.presentation.dto.RatingResponse;
import com.libraria.backend.modules.rating.presentation.dto.UpdateRatingRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RatingController {

    private final BookRatingService bookRatingService;

    public RatingController(BookRatingService bookRatingService) {
        this.bookRatingService = bookRatingService;
    }

    @GetMapping("/books/{bookId}/ratings")
    public ResponseEntity<RatingListResponse> listBookRatings(
            @PathVariable("bookId") UUID bookId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(bookRatingService.listRatingsForBook(bookId, page, size));
    }

    @Operation(summary = "Rate a book", description = "Creates the caller's rating (201) or replaces the existing one (200).")
    @PostMapping("/books/{bookId}/rate")
    public ResponseEntity<RateBookResponse> rateBook(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("bookId") UUID bookId,
            @Valid @RequestBody RateBookRequest request
    ) {
        RateBookResponse response = bookRatingService.rate(principal.userId(), bookId, request);
        return ResponseEntity.status(response.created() ? 201 : 200).body(response);
    }

    @GetMapping("/ratings")
    public ResponseEntity<RatingListResponse> listRatings(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(bookRatingService.listRatings(principal, page, size));
    }

    @PatchMapping("/ratings/{ratingId}")
    public ResponseEntity<RatingResponse> updateRating(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("ratingId") UUID ratingId,
            @Valid @RequestBody UpdateRatingRequest request
    ) {
        return ResponseEntity.ok(bookRatingService.updateRating(ratingId, request, principal));
    }

    @DeleteMapping("/ratings/{ratingId}")
    public ResponseEntity<Void> deleteRating(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("ratingId") UUID ratingId
    ) {
        bookRatingService.deleteRating(ratingId, principal);
        return ResponseEntity.noContent().build();
    }
}
