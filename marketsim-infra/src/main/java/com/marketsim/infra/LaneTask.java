package com.marketsim.infra;

import com.marketsim.api.ErrorCode;
import com.marketsim.api.Result;
import com.marketsim.core.SymbolEngine;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Work for a lane thread together with the future its caller waits on. The
 * type parameter ties the action's result to the reply.
 */
final class LaneTask<T> {

    private final Function<SymbolEngine, Result<T>> action;
    private final CompletableFuture<Result<T>> reply = new CompletableFuture<>();

    LaneTask(Function<SymbolEngine, Result<T>> action) {
        this.action = action;
    }

    void run(SymbolEngine engine) {
        reply.complete(action.apply(engine));
    }

    void fail(ErrorCode code, String message) {
        reply.complete(Result.error(code, message));
    }

    CompletableFuture<Result<T>> reply() {
        return reply;
    }
}
