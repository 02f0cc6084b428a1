package com.crosswatch.domain.market;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SymbolTest {

    @Test
    void normalizesToNativeForm() {
        assertThat(Symbol.of(" btc/usdt ").value()).isEqualTo("BTCUSDT");
        assertThat(Symbol.of("ETH-USDT")).isEqualTo(Symbol.of("ethusdt"));
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> Symbol.of("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Symbol.of("BTC USDT")).isInstanceOf(IllegalArgumentException.class);
    }
}
