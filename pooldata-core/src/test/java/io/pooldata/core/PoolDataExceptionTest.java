package io.pooldata.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PoolDataExceptionTest {

    @Test
    void shouldConstructExceptionWithCauseOnly() {
        var cause = new IllegalStateException("root");

        var exception = new PoolDataException(cause);

        assertThat(exception.getCause()).isSameAs(cause);
    }

    @Test
    void shouldConstructExceptionWithMessageAndCause() {
        var cause = new IllegalArgumentException("bad");

        var exception = new PoolDataException("boom", cause);

        assertThat(exception.getMessage()).isEqualTo("boom");
        assertThat(exception.getCause()).isSameAs(cause);
    }

    @Test
    void shouldConstructExceptionWithMessageOnly() {
        var exception = new PoolDataException("only-message");

        assertThat(exception.getMessage()).isEqualTo("only-message");
        assertThat(exception.getCause()).isNull();
    }

    @Test
    void shouldReportOffendingReference() {
        var exception = new ReferenceOutOfRangeException(3, 2);

        assertThat(exception).isInstanceOf(PoolDataException.class);
        assertThat(exception.reference()).isEqualTo(3);
        assertThat(exception.poolSize()).isEqualTo(2);
        assertThat(exception.getMessage()).contains("beyond the end");
    }

    @Test
    void shouldReportValueMissingFromFixedPool() {
        var exception = new ValueNotInPoolException("z");

        assertThat(exception).isInstanceOf(PoolDataException.class);
        assertThat(exception.value()).isEqualTo("z");
        assertThat(exception.getMessage()).isEqualTo("value not in provided pool: z");
    }

    @Test
    void shouldReportReplaceSourceWithOptionalCause() {
        var cause = new IllegalArgumentException("not convertible");

        var plain = new ReplaceSourceNotFoundException("q");
        var caused = new ReplaceSourceNotFoundException("q", cause);

        assertThat(plain.value()).isEqualTo("q");
        assertThat(plain.getCause()).isNull();
        assertThat(caused.getCause()).isSameAs(cause);
        assertThat(caused.getMessage()).isEqualTo(plain.getMessage());
    }

    @Test
    void shouldReportUnsupportedElementType() {
        var exception = new UnsupportedElementKindException(Void.class, "setMissing(mask)");

        assertThat(exception.type()).isEqualTo(Void.class);
        assertThat(exception.getMessage()).startsWith("setMissing(mask) is not supported");
    }
}
