package org.decentmobility.matching;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.Need;

import java.util.Objects;
import java.util.Optional;

/**
 * One matched entry: a need, an alternative, or both, sharing an origin/destination key.
 *
 * <p>At least one side is always present.</p>
 */
@EqualsAndHashCode
@ToString
public final class NeedAlternativePair {
    @Getter
    @Accessors(fluent = true)
    private final ODKey key;
    private final Need need;
    private final Alternative alternative;

    NeedAlternativePair(ODKey key, Need need, Alternative alternative) {
        this.key = Objects.requireNonNull(key, "key");
        if (need == null && alternative == null) {
            throw new IllegalArgumentException("pair requires a need or an alternative");
        }
        this.need = need;
        this.alternative = alternative;
    }

    /**
     * Returns the need bound to this key, if any.
     */
    public Optional<Need> need() {
        return Optional.ofNullable(need);
    }

    /**
     * Returns the alternative attached to this key, if any.
     */
    public Optional<Alternative> alternative() {
        return Optional.ofNullable(alternative);
    }

    /**
     * Returns true when both a need and an alternative are present.
     */
    public boolean isMatched() {
        return need != null && alternative != null;
    }
}
