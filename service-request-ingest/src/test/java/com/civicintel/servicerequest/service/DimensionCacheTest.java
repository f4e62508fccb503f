package com.civicintel.servicerequest.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DimensionCacheTest {

    @Test
    void evictsLeastRecentlyUsedWhenFull() {
        DimensionCache cache = new DimensionCache(2);
        cache.put("NYPD", 1);
        cache.put("DSNY", 2);
        cache.get("NYPD");          // DSNY is now the eldest
        cache.put("HPD", 3);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("NYPD")).isEqualTo(1L);
        assertThat(cache.get("HPD")).isEqualTo(3L);
        assertThat(cache.get("DSNY")).isNull();
    }

    @Test
    void clearEmptiesCache() {
        DimensionCache cache = new DimensionCache(10);
        cache.put("QUEENS", 7);
        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.get("QUEENS")).isNull();
    }

    @Test
    void rejectsNonPositiveBound() {
        assertThatThrownBy(() -> new DimensionCache(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
