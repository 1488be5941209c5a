package net.custodian.adapter.jdbc.mapper;

import net.custodian.adapter.jdbc.JdbcUtil;
import net.custodian.adapter.jdbc.repo.StoredOption;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- StoredOption ---
    public static StoredOption toStoredOption(ResultSet rs) throws SQLException {
        String value = rs.getString("OPTION_VALUE");
        return new StoredOption(
                rs.getString("OPTION_NAME"),
                value == null ? "" : value,    // Oracle: '' == NULL
                JdbcUtil.toInstant(rs.getTimestamp("UPDATED_AT"))
        );
    }
}
