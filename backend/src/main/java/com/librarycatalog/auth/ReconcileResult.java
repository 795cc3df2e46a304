package com.librarycatalog.auth;

import java.util.List;

/**
 * Terminal state of one reconcile: the stored user, or the reasons it failed.
 */
public record ReconcileResult(Status status, UserIdentity user, boolean created, List<String> errors) {

    public enum Status {
        AUTHENTICATED,
        FAILED
    }

    public ReconcileResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ReconcileResult created(UserIdentity user) {
        return new ReconcileResult(Status.AUTHENTICATED, user, true, List.of());
    }

    public static ReconcileResult updated(UserIdentity user) {
        return new ReconcileResult(Status.AUTHENTICATED, user, false, List.of());
    }

    public static ReconcileResult failed(List<String> errors) {
        return new ReconcileResult(Status.FAILED, null, false, errors);
    }

    public boolean isAuthenticated() {
        return status == Status.AUTHENTICATED;
    }
}
