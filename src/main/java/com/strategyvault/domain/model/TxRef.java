package com.strategyvault.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Reference returned by the settlement gateway for a completed transfer. */
@Value
@Builder
public class TxRef {

    String reference;
    String asset;
    String from;
    String to;
    BigDecimal amount;
}
