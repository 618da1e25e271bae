package com.lendingpool.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssetIdsTest {

    @Test
    void symbolsAreUpperCased() {
        assertThat(AssetIds.normalize(" weth ")).isEqualTo("WETH");
    }

    @Test
    void addressesAreLowerCased() {
        assertThat(AssetIds.normalize("0xA0b86991C6218b36c1d19D4a2e9Eb0cE3606eB48"))
                .isEqualTo("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48");
    }

    @Test
    void rejectsBlankAndShortAddresses() {
        assertThatThrownBy(() -> AssetIds.normalize(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssetIds.normalize(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssetIds.normalize("0x1234")).isInstanceOf(IllegalArgumentException.class);
    }
}
