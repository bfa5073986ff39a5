package com.theobroma.perf.repository.jooq;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.jooq.tools.jdbc.MockResult;

/**
 * Builds jOOQ mock results column by column.
 */
final class MockRows {

    private static final DSLContext CREATE = DSL.using(SQLDialect.POSTGRES);

    private final List<Field<?>> fields = new ArrayList<>();
    private final List<Object[]> rows = new ArrayList<>();

    /**
     * Column order must follow the select list of the query under test.
     */
    static MockRows columns(Map<String, Class<?>> columns) {
        MockRows mockRows = new MockRows();
        columns.forEach((column, type) -> mockRows.fields.add(field(name(column), type)));
        return mockRows;
    }

    MockRows row(Object... values) {
        rows.add(values);
        return this;
    }

    MockResult toResult() {
        Field<?>[] columns = fields.toArray(new Field<?>[0]);
        Result<Record> result = CREATE.newResult(columns);
        for (Object[] values : rows) {
            Record record = CREATE.newRecord(columns);
            record.fromArray(values);
            result.add(record);
        }
        return new MockResult(rows.size(), result);
    }
}
