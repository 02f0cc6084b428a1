package com.crosswatch.infrastructure.execution;

import com.crosswatch.application.execution.ExecutionRequest;
import com.crosswatch.application.execution.OrderResult;
import com.crosswatch.application.ports.OrderExecutionPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/** Paper execution: every order is accepted and gets a synthetic id. Nothing leaves the process. */
public class PaperOrderExecution implements OrderExecutionPort {

    private static final Logger log = LoggerFactory.getLogger(PaperOrderExecution.class);

    private final AtomicLong sequence = new AtomicLong();
    private final String prefix;

    public PaperOrderExecution() {
        this("PAPER-" + System.currentTimeMillis() + "-");
    }

    public PaperOrderExecution(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public OrderResult submitOrder(ExecutionRequest request) {
        String id = prefix + sequence.incrementAndGet();
        log.info("[PAPER] {} {} qty={} -> {}", request.side(), request.symbol(), request.quantity(), id);
        return OrderResult.success(id);
    }
}
