package de.bsommerfeld.repoindex.core.flat;

import java.time.Instant;
import java.util.Collection;

/**
 * When a flat index field counts as present. Absent fields are left out of
 * the document entirely; the flat format never carries {@code null},
 * {@code ""}, {@code []}, {@code false} or {@code 0}.
 */
public enum Presence {

    NON_EMPTY_TEXT {
        @Override
        boolean test(Object value) {
            return value instanceof String s && !s.isEmpty();
        }
    },
    NON_EMPTY_LIST {
        @Override
        boolean test(Object value) {
            return value instanceof Collection<?> c && !c.isEmpty();
        }
    },
    NON_ZERO {
        @Override
        boolean test(Object value) {
            return value instanceof Number n && n.longValue() != 0;
        }
    },
    NON_NULL_INSTANT {
        @Override
        boolean test(Object value) {
            return value instanceof Instant;
        }
    };

    abstract boolean test(Object value);
}
