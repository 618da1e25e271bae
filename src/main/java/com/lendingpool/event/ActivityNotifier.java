package com.lendingpool.event;

/**
 * Side channel for activity events. Implementations must report problems through
 * {@link NotificationResult} and never throw into the accounting path.
 */
public interface ActivityNotifier {

    NotificationResult notify(LendingActivity activity);

    NotificationResult notify(LiquidationExecuted liquidation);
}
