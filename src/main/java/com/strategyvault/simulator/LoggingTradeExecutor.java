package com.strategyvault.simulator;

import com.strategyvault.domain.enums.TradeDirection;
import com.strategyvault.domain.model.Strategy;
import com.strategyvault.execution.TradeExecutionPort;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Paper execution: records and logs every trade instead of routing it to a venue. */
public class LoggingTradeExecutor implements TradeExecutionPort {

    private static final Logger log = LoggerFactory.getLogger(LoggingTradeExecutor.class);

    private final List<ExecutedTrade> trades = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void executeTrade(Strategy strategy, TradeDirection direction, BigDecimal amount) {
        trades.add(new ExecutedTrade(strategy.getId(), strategy.getBaseAsset(), direction, amount, Instant.now()));
        log.info(
                "Paper trade: strategy={}, {} {} of {}/{}",
                strategy.getId(),
                direction,
                amount.toPlainString(),
                strategy.getBaseAsset(),
                strategy.getQuoteAsset());
    }

    public List<ExecutedTrade> getTrades() {
        synchronized (trades) {
            return List.copyOf(trades);
        }
    }

    @Value
    public static class ExecutedTrade {
        String strategyId;
        String asset;
        TradeDirection direction;
        BigDecimal amount;
        Instant executedAt;
    }
}
