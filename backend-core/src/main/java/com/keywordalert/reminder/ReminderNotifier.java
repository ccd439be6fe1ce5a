package com.keywordalert.reminder;

import java.time.Duration;

/**
 * Delivers one reminder notification. Called while the user's reminder lock is held, so
 * implementations must only hand the work off and return.
 */
public interface ReminderNotifier {

    void notifyReminder(Reminder reminder, int reminderNumber, Duration elapsed);
}
