package io.mnemo.core.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class StoreResultTest {

    @Test
    void shouldMapSuccessfulValue() {
        StoreResult<Integer> result = StoreResult.ok("four").map(String::length);

        assertThat(result.isOk()).isTrue();
        assertThat(result.value()).isEqualTo(4);
    }

    @Test
    void shouldCarryFailureThroughMapAndPropagate() {
        StoreResult<String> failure = StoreResult.failure(StoreError.entityNotFound("ghost"));

        StoreResult<Integer> mapped = failure.map(String::length);
        StoreResult<Long> propagated = failure.propagate();

        assertThat(mapped.error().kind()).isEqualTo(ErrorKind.ENTITY_NOT_FOUND);
        assertThat(propagated.error().message()).isEqualTo("Entity not found: ghost");
    }

    @Test
    void shouldRejectPropagatingSuccess() {
        assertThatThrownBy(() -> StoreResult.ok(1).propagate()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldThrowStoreExceptionFromOrElseThrow() {
        StoreResult<String> failure = StoreResult.failure(ErrorKind.INVALID_ARGUMENT, "bad input");

        assertThatThrownBy(failure::orElseThrow)
            .isInstanceOf(StoreException.class)
            .satisfies(e -> assertThat(((StoreException) e).error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT));
    }
}
