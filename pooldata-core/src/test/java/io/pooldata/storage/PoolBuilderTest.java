package io.pooldata.storage;

import io.pooldata.core.PoolCapacityExceededException;
import io.pooldata.core.PoolingConfiguration;
import io.pooldata.core.RefWidth;
import io.pooldata.core.ValueNotInPoolException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoolBuilderTest {

    private static final PoolingConfiguration UINT8 = PoolingConfiguration.builder()
            .refWidth(RefWidth.UINT8)
            .build();

    @Test
    void shouldBuildSortedPoolAndRankReferences() {
        var column = PoolBuilder.forType(String.class).encode(Arrays.asList("b", "a", "b", null));

        assertThat(column.pool()).containsExactly("a", "b");
        assertThat(column.references().toIntArray()).containsExactly(2, 1, 2, 0);
    }

    @Test
    void shouldAssignReferencesByRankNotFirstAppearance() {
        var column = PoolBuilder.forType(Integer.class).encode(List.of(5, 3, 5, 1, 3));

        assertThat(column.pool()).containsExactly(1, 3, 5);
        assertThat(column.references().toIntArray()).containsExactly(3, 2, 3, 1, 2);
    }

    @Test
    void shouldExcludeMaskedValuesFromPool() {
        var column = PoolBuilder.forType(String.class)
                .encode(List.of("a", "b", "a", "x"), new boolean[]{false, false, false, true});

        assertThat(column.pool()).containsExactly("a", "b");
        assertThat(column.references().toIntArray()).containsExactly(1, 2, 1, 0);
    }

    @Test
    void shouldRoundTripValuesAndMissingness() {
        var values = List.of("delta", "alpha", "delta", "charlie", "alpha", "bravo");
        var mask = new boolean[]{false, true, false, false, true, false};

        var decoded = PoolBuilder.forType(String.class).encode(values, mask).decodeAll();

        for (var i = 0; i < values.size(); i++) {
            assertThat(decoded.isMissing(i)).isEqualTo(mask[i]);
            if (!mask[i]) {
                assertThat(decoded.get(i)).isEqualTo(values.get(i));
            }
        }
    }

    @Test
    void shouldOrderPoolWithCustomComparator() {
        var column = PoolBuilder.forType(String.class, Comparator.<String>reverseOrder())
                .encode(List.of("a", "c", "b"));

        assertThat(column.pool()).containsExactly("c", "b", "a");
        assertThat(column.references().toIntArray()).containsExactly(3, 1, 2);
    }

    @Test
    void shouldEncodeDenseColumn() {
        var dense = DenseColumn.of(String.class, List.of("x", "y", "x"), new boolean[]{false, false, true});

        var column = PoolBuilder.forType(String.class).encode(dense);

        assertThat(column.references().toIntArray()).containsExactly(1, 2, 0);
        assertThat(column.decodeAll()).isEqualTo(dense);
    }

    @Test
    void shouldEncodeEmptyInput() {
        var column = PoolBuilder.forType(String.class).encode(List.of());

        assertThat(column.size()).isZero();
        assertThat(column.pool()).isEmpty();
    }

    @Test
    void shouldAcceptDistinctValuesUpToWidthMaximum() {
        var values = IntStream.range(0, 255).boxed().collect(Collectors.toList());

        var column = PoolBuilder.forType(Integer.class).configuration(UINT8).encode(values);

        assertThat(column.poolSize()).isEqualTo(255);
        assertThat(column.references().get(254)).isEqualTo(255);
        assertThat(column.get(254)).isEqualTo(254);
    }

    @Test
    void shouldRejectDistinctValuesBeyondWidthMaximum() {
        var values = IntStream.range(0, 256).boxed().collect(Collectors.toList());
        var builder = PoolBuilder.forType(Integer.class).configuration(UINT8);

        assertThatThrownBy(() -> builder.encode(values))
                .isInstanceOfSatisfying(PoolCapacityExceededException.class,
                        e -> assertThat(e.requested()).isEqualTo(256));
    }

    @Test
    void shouldDedupeAndSortSuppliedPool() {
        var column = PoolBuilder.forType(String.class)
                .encodeWithPool(List.of("b", "a"), List.of("c", "a", "b", "a"));

        assertThat(column.pool()).containsExactly("a", "b", "c");
        assertThat(column.references().toIntArray()).containsExactly(2, 1);
    }

    @Test
    void shouldIgnoreMissingPositionsWhenCheckingSuppliedPool() {
        var column = PoolBuilder.forType(String.class)
                .encodeWithPool(List.of("a", "zzz"), List.of("a"), new boolean[]{false, true});

        assertThat(column.references().toIntArray()).containsExactly(1, 0);
    }

    @Test
    void shouldRejectValueAbsentFromSuppliedPool() {
        var builder = PoolBuilder.forType(String.class);

        assertThatThrownBy(() -> builder.encodeWithPool(List.of("a", "z"), List.of("a", "b")))
                .isInstanceOfSatisfying(ValueNotInPoolException.class,
                        e -> assertThat(e.value()).isEqualTo("z"))
                .hasMessageContaining("value not in provided pool");
    }

    @Test
    void shouldCheckSuppliedPoolLengthAgainstWidth() {
        var fits = IntStream.range(0, 255).boxed().collect(Collectors.toList());
        var tooLong = IntStream.range(0, 256).boxed().collect(Collectors.toList());
        var builder = PoolBuilder.forType(Integer.class).configuration(UINT8);

        assertThatCode(() -> builder.encodeWithPool(List.of(3), fits)).doesNotThrowAnyException();
        assertThatThrownBy(() -> builder.encodeWithPool(List.of(3), tooLong))
                .isInstanceOf(PoolCapacityExceededException.class);
    }

    @Test
    void shouldRejectMismatchedMaskLength() {
        var builder = PoolBuilder.forType(String.class);

        assertThatThrownBy(() -> builder.encode(List.of("a", "b"), new boolean[1]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("differ in length");
    }

    @Test
    void shouldBuildAllMissingColumn() {
        var column = PoolBuilder.forType(String.class).allMissing(3);

        assertThat(column.size()).isEqualTo(3);
        assertThat(column.pool()).isEmpty();
        assertThat(column.missingMask()).containsExactly(true, true, true);
    }

    @Test
    void shouldStoreReferencesAtConfiguredWidth() {
        var values = IntStream.range(0, 300).boxed().collect(Collectors.toList());

        var column = PoolBuilder.forType(Integer.class).encode(values);

        assertThat(column.configuration().refWidth()).isEqualTo(RefWidth.UINT16);
        assertThat(column.references().get(299)).isEqualTo(300);
    }

    @Test
    void shouldFillColumnWithSingleValue() {
        var column = PoolBuilder.forType(String.class).filled("x", 3);

        assertThat(column.pool()).containsExactly("x");
        assertThat(column.references().toIntArray()).containsExactly(1, 1, 1);
    }

    @Test
    void shouldBuildZerosAndOnesThroughConverter() {
        var zeros = PoolBuilder.forType(Long.class).zeros(2);
        var ones = PoolBuilder.forType(Double.class).ones(2);

        assertThat(zeros.decodeAll()).isEqualTo(DenseColumn.of(Long.class, 0L, 0L));
        assertThat(ones.decodeAll()).isEqualTo(DenseColumn.of(Double.class, 1.0, 1.0));
        assertThatThrownBy(() -> PoolBuilder.forType(String.class).zeros(1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldBuildBooleanColumns() {
        var trues = PoolBuilder.trues(2);
        var falses = PoolBuilder.falses(2);

        assertThat(trues.pool()).containsExactly(true);
        assertThat(falses.get(1)).isFalse();
        assertThat(PooledColumn.whereTrue(trues)).containsExactly(0, 1);
        assertThat(PooledColumn.whereTrue(falses)).isEmpty();
    }

    @Test
    void shouldRejectMissingFillValue() {
        assertThatThrownBy(() -> PoolBuilder.forType(String.class).filled(null, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("allMissing");
        assertThatThrownBy(() -> PoolBuilder.forType(String.class).filled("x", -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
