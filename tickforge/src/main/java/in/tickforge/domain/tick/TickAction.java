package in.tickforge.domain.tick;

/**
 * Discriminator of {@link TickResult} variants.
 */
public enum TickAction {
    IDLE,
    SCHEDULED,
    OPENED,
    ACTIVE,
    CLOSED,
    CANCELLED
}
