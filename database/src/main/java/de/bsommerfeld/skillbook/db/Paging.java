package de.bsommerfeld.skillbook.db;

import de.bsommerfeld.skillbook.core.validation.Validator;

/** List bounds shared by every store. */
final class Paging {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;

    private Paging() {
    }

    static Validator check(Validator validator, int limit, int offset) {
        return validator
                .range("limit", limit, 1, MAX_LIMIT)
                .min("offset", offset, 0);
    }
}
