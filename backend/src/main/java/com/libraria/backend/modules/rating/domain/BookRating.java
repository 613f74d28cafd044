package com.libraria.backend.modules.rating.domain;

import java.util.UUID;

import com.libraria.backend.global.jpa.AbstractTimestampedEntity;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.catalog.domain.Book;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(
        name = "book_rating",
        uniqueConstraints = @UniqueConstraint(name = "uq_book_rating_user_book", columnNames = {"user_id", "book_id"})
)
public class BookRating extends AbstractTimestampedEntity {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private LibraryUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false, updatable = false)
    private Book book;

    @Column(name = "rating", nullable = false)
    private int rating;

    @Column(name = "review", columnDefinition = "text")
    private String review;

    protected BookRating() {
    }

    public BookRating(LibraryUser user, Book book, int rating, String review) {
        this.user = user;
        this.book = book;
        this.rating = rating;
        this.review = review;
    }

    public UUID getId() {
        return id;
    }

    public LibraryUser getUser() {
        return user;
    }

    public Book getBook() {
        return book;
    }

    public int getRating() {
        return rating;
    }

    public void setRating(int rating) {
        this.rating = rating;
    }

    public String getReview() {
        return review;
    }

    public void setReview(String review) {
        this.review = review;
    }
}
