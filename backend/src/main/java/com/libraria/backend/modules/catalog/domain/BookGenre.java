package com.libraria.backend.modules.catalog.domain;

public enum BookGenre {
    FICTION,
    NON_FICTION,
    MYSTERY,
    ROMANCE,
    SCIENCE_FICTION,
    FANTASY,
    BIOGRAPHY,
    HISTORY,
    SCIENCE,
    TECHNOLOGY,
    SELF_HELP,
    CHILDREN,
    YOUNG_ADULT,
    POETRY,
    DRAMA,
    OTHER
}
