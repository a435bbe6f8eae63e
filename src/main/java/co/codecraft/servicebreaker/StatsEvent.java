package co.codecraft.servicebreaker;

/**
 * The kinds of outcome a breaker counts for a service.
 */
public enum StatsEvent {

    /** A request reached the service and succeeded. */
    SUCCESS,

    /** A request reached the service (or tried to) and failed. */
    FAILURE,

    /** A request was rejected by an open circuit and never sent. */
    REJECTION
}
