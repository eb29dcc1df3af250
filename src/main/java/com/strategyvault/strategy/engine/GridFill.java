package com.strategyvault.strategy.engine;

import com.strategyvault.domain.model.GridOrder;
import java.math.BigDecimal;
import lombok.Value;

/** One crossed grid order and the opposite-side order that replaced it. */
@Value
public class GridFill {

    GridOrder filledOrder;
    GridOrder replacementOrder;
    BigDecimal marketPrice;
}
