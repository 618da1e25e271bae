package com.lendingpool.event;

/**
 * Outcome of a best-effort notification. Callers may inspect or ignore it;
 * a failed notification never fails the operation that produced it.
 */
public record NotificationResult(boolean recorded, String error) {

    private static final NotificationResult OK = new NotificationResult(true, null);

    public static NotificationResult ok() {
        return OK;
    }

    public static NotificationResult failed(String error) {
        return new NotificationResult(false, error == null ? "unknown" : error);
    }
}
