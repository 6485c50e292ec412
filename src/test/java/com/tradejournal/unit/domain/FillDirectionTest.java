package com.tradejournal.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.domain.enums.FillDirection;
import com.tradejournal.domain.enums.Side;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FillDirectionTest {

    @ParameterizedTest
    @CsvSource({
        "Open Long, OPEN",
        "Open Short, OPEN",
        "Close Long, CLOSE",
        "Close Short, CLOSE",
        "Long > Short, UNKNOWN",
        "Settlement, UNKNOWN",
        "open long, UNKNOWN",
        "'', UNKNOWN"
    })
    void classifiesByPrefix(String tag, FillDirection expected) {
        assertThat(FillDirection.fromTag(tag)).isEqualTo(expected);
    }

    @Test
    void nullTagIsUnknown() {
        assertThat(FillDirection.fromTag(null)).isEqualTo(FillDirection.UNKNOWN);
    }

    @Test
    void sideCodesAndSigns() {
        assertThat(Side.fromVenueCode("B")).isEqualTo(Side.BUY);
        assertThat(Side.fromVenueCode("A")).isEqualTo(Side.SELL);
        assertThat(Side.SELL.signed(new BigDecimal("2.5"))).isEqualByComparingTo("-2.5");
        assertThat(Side.BUY.signed(new BigDecimal("2.5"))).isEqualByComparingTo("2.5");
        assertThat(Side.BUY.isLong()).isTrue();
        assertThat(Side.SELL.getVenueCode()).isEqualTo("A");
    }
}
