package com.tradesim.gateway;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Balance {

    String asset;
    BigDecimal free;
    BigDecimal locked;

    public BigDecimal total() {
        return free.add(locked);
    }
}
