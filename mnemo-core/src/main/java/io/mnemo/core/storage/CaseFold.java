package io.mnemo.core.storage;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import org.sqlite.Function;

/**
 * {@code fold(text)}: Unicode lower-casing for search. SQLite's own {@code LIKE} and
 * {@code lower()} only fold ASCII.
 */
public final class CaseFold extends Function {
    public static final String NAME = "fold";

    static void register(Connection connection) throws SQLException {
        Function.create(connection, NAME, new CaseFold());
    }

    public static String apply(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    @Override
    protected void xFunc() throws SQLException {
        String value = value_text(0);
        if (value == null) {
            result();
        } else {
            result(apply(value));
        }
    }
}
