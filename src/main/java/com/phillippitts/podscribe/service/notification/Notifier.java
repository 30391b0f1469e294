package com.phillippitts.podscribe.service.notification;

import com.phillippitts.podscribe.exception.NotificationException;

import java.nio.file.Path;

/**
 * Announces a finished transcript. Delivery is best effort: callers log failures and move on.
 */
public interface Notifier {

    /**
     * @param title          episode title as discovered
     * @param transcriptPath final transcript file
     * @throws NotificationException if delivery fails
     */
    void notify(String title, Path transcriptPath);
}
