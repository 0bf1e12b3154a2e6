package mu.fleet.view;

/**
 * Who is using a machine relative to its owner.
 */
public enum OwnerActivity {
    /** The owner is the active user. */
    OWNER_ACTIVE,
    /** Someone other than the named owner is the active user. */
    OTHER_ACTIVE,
    /** No active user, or the machine has no named owner. */
    NONE
}
