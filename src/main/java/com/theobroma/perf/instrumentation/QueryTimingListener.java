package com.theobroma.perf.instrumentation;

import org.jooq.ExecuteContext;
import org.jooq.ExecuteListener;
import org.jooq.Query;

import lombok.RequiredArgsConstructor;

/**
 * jOOQ listener that routes every query of a {@code DSLContext} through {@link QueryTimer}.
 *
 * The clock starts when jOOQ starts the execution lifecycle and stops when it ends
 * or fails, so rendering, binding, execution and fetching are all included. A failed
 * execution is reported from {@link #exception}; the start mark is consumed there so
 * the following {@link #end} does not report it a second time.
 *
 * Registered by {@link com.theobroma.perf.config.JooqConfig}; data-access code needs
 * no timing calls of its own.
 */
@RequiredArgsConstructor
public class QueryTimingListener implements ExecuteListener {

    private static final String START_NANOS = QueryTimingListener.class.getName() + ".start";

    private final QueryTimer queryTimer;

    @Override
    public void start(ExecuteContext ctx) {
        ctx.data(START_NANOS, System.nanoTime());
    }

    @Override
    public void exception(ExecuteContext ctx) {
        complete(ctx, false);
    }

    @Override
    public void end(ExecuteContext ctx) {
        complete(ctx, ctx.exception() == null);
    }

    private void complete(ExecuteContext ctx, boolean success) {
        Object start = ctx.data().remove(START_NANOS);
        if (!(start instanceof Long)) {
            return;
        }
        long elapsed = System.nanoTime() - (Long) start;
        queryTimer.report(sql(ctx), bindValues(ctx), elapsed, success);
    }

    private static String sql(ExecuteContext ctx) {
        if (ctx.sql() != null) {
            return ctx.sql();
        }
        String[] batch = ctx.batchSQL();
        if (batch != null && batch.length > 0) {
            return String.join("; ", batch);
        }
        Query query = ctx.query();
        return query == null ? null : query.getSQL();
    }

    private static Object[] bindValues(ExecuteContext ctx) {
        Query query = ctx.query();
        if (query == null) {
            return new Object[0];
        }
        try {
            return query.getBindValues().toArray();
        } catch (RuntimeException e) {
            // Bind values cannot be extracted from every query type
            return new Object[0];
        }
    }
}
