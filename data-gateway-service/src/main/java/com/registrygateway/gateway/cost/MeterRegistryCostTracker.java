package com.registrygateway.gateway.cost;

import com.registrygateway.common.model.OperationKind;
import com.registrygateway.gateway.config.GatewaySettings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Publishes provider spend as Micrometer counters:
 * <ul>
 *   <li>{@code gateway.provider.cost}  (tags: provider, operation) summed cost</li>
 *   <li>{@code gateway.provider.calls} (tags: provider, operation) number of paid calls</li>
 * </ul>
 *
 * <p>Keeps a running total and logs one warning when it crosses
 * {@code budgetLimit × alertThreshold}. The budget is advisory; nothing is refused.
 */
@Component
public class MeterRegistryCostTracker implements CostTracker {

    private static final Logger log = LoggerFactory.getLogger(MeterRegistryCostTracker.class);

    static final String COST_METRIC  = "gateway.provider.cost";
    static final String CALLS_METRIC = "gateway.provider.calls";

    private final MeterRegistry meterRegistry;
    private final double alertSpend;
    private final DoubleAdder totalSpend = new DoubleAdder();
    private final AtomicBoolean budgetAlerted = new AtomicBoolean(false);

    public MeterRegistryCostTracker(MeterRegistry meterRegistry, GatewaySettings settings) {
        this.meterRegistry = meterRegistry;
        this.alertSpend    = settings.budgetLimit() * settings.alertThreshold();
    }

    @Override
    public void record(String providerName, OperationKind operation, double cost) {
        Counter.builder(COST_METRIC)
            .tag("provider", providerName)
            .tag("operation", operation.code())
            .register(meterRegistry)
            .increment(cost);
        Counter.builder(CALLS_METRIC)
            .tag("provider", providerName)
            .tag("operation", operation.code())
            .register(meterRegistry)
            .increment();

        totalSpend.add(cost);
        double spent = totalSpend.sum();
        log.debug("COST_RECORDED provider={} operation={} cost={} totalSpend={}",
            providerName, operation.code(), cost, spent);
        if (spent >= alertSpend && budgetAlerted.compareAndSet(false, true)) {
            log.warn("BUDGET_ALERT totalSpend={} alertSpend={}", spent, alertSpend);
        }
    }

    public double totalSpend() {
        return totalSpend.sum();
    }

    public boolean budgetAlerted() {
        return budgetAlerted.get();
    }
}
