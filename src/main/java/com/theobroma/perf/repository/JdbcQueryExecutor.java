package com.theobroma.perf.repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

import org.springframework.jdbc.UncategorizedSQLException;

import com.theobroma.perf.instrumentation.QueryExecutor;

import lombok.RequiredArgsConstructor;

/**
 * Plain JDBC {@link QueryExecutor} over the pooled {@link DataSource}.
 *
 * Used for statements that do not go through jOOQ (connectivity checks, ad-hoc
 * diagnostics). Failures surface as {@link UncategorizedSQLException} carrying the
 * original {@link SQLException}.
 */
@RequiredArgsConstructor
public class JdbcQueryExecutor implements QueryExecutor {

    private final DataSource dataSource;

    @Override
    public QueryResult execute(String sql, Object... parameters) {
        long startTime = System.nanoTime();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            if (parameters != null) {
                for (int i = 0; i < parameters.length; i++) {
                    ps.setObject(i + 1, parameters[i]);
                }
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            if (ps.execute()) {
                try (ResultSet rs = ps.getResultSet()) {
                    ResultSetMetaData meta = rs.getMetaData();
                    int columns = meta.getColumnCount();
                    while (rs.next()) {
                        Map<String, Object> row = new LinkedHashMap<>();
                        for (int c = 1; c <= columns; c++) {
                            row.put(meta.getColumnLabel(c), rs.getObject(c));
                        }
                        rows.add(row);
                    }
                }
            }

            return new QueryResult(rows, (System.nanoTime() - startTime) / 1_000_000_000.0);

        } catch (SQLException e) {
            throw new UncategorizedSQLException("Query execution", sql, e);
        }
    }
}
