package com.robusta.sandbox.rdb;

/**
 * The single row of a {@link DbController#queryForRow} query.
 * <p>
 * An empty result is not a failure by itself: every read on an absent row throws
 * {@link DriverException}, so a callback that simply scans fails when nothing was found,
 * while one that checks {@link #isPresent()} first can react otherwise.
 * Only valid during the callback it was handed to.
 */
public class RowExt {
    static final String NO_ROWS = "no rows in result set";

    private final RowsExt rows;
    private final boolean present;

    RowExt(RowsExt rows, boolean present) {
        this.rows = rows;
        this.present = present;
    }

    public boolean isPresent() {
        return present;
    }

    public Object[] scan() {
        return presentRows().scan();
    }

    public Object getObject(int column) {
        return presentRows().getObject(column);
    }

    public Object getObject(String column) {
        return presentRows().getObject(column);
    }

    public String getString(int column) {
        return presentRows().getString(column);
    }

    public String getString(String column) {
        return presentRows().getString(column);
    }

    public long getLong(int column) {
        return presentRows().getLong(column);
    }

    public long getLong(String column) {
        return presentRows().getLong(column);
    }

    public int getInt(int column) {
        return presentRows().getInt(column);
    }

    public int getInt(String column) {
        return presentRows().getInt(column);
    }

    private RowsExt presentRows() {
        if (!present) {
            throw new DriverException(NO_ROWS);
        }
        return rows;
    }
}
