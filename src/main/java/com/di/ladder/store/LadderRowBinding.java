package com.di.ladder.store;

import org.springframework.jdbc.core.RowMapper;

/**
 * Maps one entity kind to and from its table.
 */
public interface LadderRowBinding<E> {

    RowMapper<E> rowMapper();

    /** Positional parameters of the kind's {@code insert} statement. */
    Object[] insertParameters(E entity);
}
