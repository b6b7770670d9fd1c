package work.lcod.config.node;

/**
 * Tie-break strength used when two nodes meet at the same path during a merge.
 */
public enum Priority {
    WEAK(-1),
    DEFAULT(0),
    FORCED(1);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Returns {@code ifEqual} when both priorities match, otherwise whether this one ranks higher.
     */
    public boolean hasPriorityOver(Priority other, boolean ifEqual) {
        if (rank == other.rank) {
            return ifEqual;
        }
        return rank > other.rank;
    }
}
