package io.cardstore.server;

/**
 * Outcome of a replace or upsert.
 *
 * @param status  what happened
 * @param version stored version after a successful mutation, 0 otherwise
 * @param updated number of incoming records processed (upsert), 0 otherwise
 */
public record MutationResult(Status status, long version, int updated) {

    public enum Status { OK, UNAUTHORIZED, INVALID_BODY, WRITE_FAILED }

    static MutationResult ok(long version, int updated) {
        return new MutationResult(Status.OK, version, updated);
    }

    static MutationResult of(Status status) {
        return new MutationResult(status, 0, 0);
    }

    public boolean ok() {
        return status == Status.OK;
    }
}
