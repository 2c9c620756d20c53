package com.ndclient.endpoint;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryFilterTest {

    @Test
    void toQueryString_shouldBeEmptyWhenNothingIsSet() {
        assertThat(QueryFilter.none().toQueryString()).isEmpty();
        assertThat(QueryFilter.builder().filter("  ").limit(0).build().toQueryString()).isEmpty();
    }

    @Test
    void toQueryString_shouldRenderParametersInFixedOrder() {
        QueryFilter filter = QueryFilter.builder()
                .sort("-name")
                .offset(20)
                .max(100)
                .limit(10)
                .filter("name:f1 AND state:ready")
                .build();

        assertThat(filter.toQueryString())
                .isEqualTo("filter=name%3Af1%20AND%20state%3Aready&limit=10&max=100&offset=20&sort=-name");
    }

    @Test
    void toQueryString_shouldEncodeReservedCharacters() {
        assertThat(QueryFilter.builder().filter("name:a&b=c").build().toQueryString())
                .isEqualTo("filter=name%3Aa%26b%3Dc");
    }
}
