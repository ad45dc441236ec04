package io.pooldata.storage;

import io.pooldata.core.ReplaceSourceNotFoundException;
import io.pooldata.kernel.Missing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-place value substitution for pooled columns.
 * <p>
 * The effect depends on whether each operand is missing ({@code null} or
 * {@link Missing#VALUE}) or a concrete value:
 * <ul>
 *   <li>missing to missing: no-op</li>
 *   <li>value to missing: references to the value become 0; the pool is unchanged</li>
 *   <li>missing to value: references 0 are pointed at the value, appended to the pool if new</li>
 *   <li>value to a value already pooled: references are repointed and the old slot stays orphaned</li>
 *   <li>value to a new value: the old slot is overwritten in place</li>
 * </ul>
 * A concrete source the pool does not hold fails with
 * {@link ReplaceSourceNotFoundException}. Every check runs before anything is
 * mutated.
 */
final class PoolReplacer {
    private static final Logger LOG = LoggerFactory.getLogger(PoolReplacer.class);

    private PoolReplacer() {
    }

    /**
     * @return the replacement value, or {@code null} when it is missing
     */
    static <T> T replace(PooledColumn<T> column, Object from, Object to) {
        var fromMissing = Missing.isMissing(from);
        var toMissing = Missing.isMissing(to);
        if (fromMissing && toMissing) {
            return null;
        }

        var refs = column.refArray();
        var pool = column.mutablePool();

        var fromRef = 0;
        if (!fromMissing) {
            fromRef = sourceRef(column, from);
        }
        if (toMissing) {
            var changed = refs.replaceAll(fromRef, 0);
            LOG.debug("Replaced {} with missing at {} positions", from, changed);
            return null;
        }

        T target = column.converter().convert(to);
        var toRef = pool.indexOf(target);
        if (fromMissing) {
            if (toRef == 0) {
                toRef = pool.append(target);
            }
            var changed = refs.replaceAll(0, toRef);
            LOG.debug("Replaced missing with {} (reference {}) at {} positions", target, toRef, changed);
        } else if (toRef != 0) {
            var changed = refs.replaceAll(fromRef, toRef);
            LOG.debug("Repointed {} positions from reference {} to {}", changed, fromRef, toRef);
        } else {
            pool.overwrite(fromRef, target);
            LOG.debug("Renamed pool slot {} from {} to {}", fromRef, from, target);
        }
        return target;
    }

    private static <T> int sourceRef(PooledColumn<T> column, Object from) {
        T source;
        try {
            source = column.converter().convert(from);
        } catch (IllegalArgumentException e) {
            throw new ReplaceSourceNotFoundException(from, e);
        }
        var ref = column.mutablePool().indexOf(source);
        if (ref == 0) {
            throw new ReplaceSourceNotFoundException(from);
        }
        return ref;
    }
}
