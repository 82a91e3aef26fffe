package com.chicu.opsdash.aggregate;

/**
 * Запись read/ack обратно в источник.
 * Best-effort: реализации не бросают, результат только для логов и тестов.
 */
public interface WriteBackClient {

    boolean markNotificationRead(String id);

    boolean markAllNotificationsRead();

    boolean acknowledgeAnomaly(String id);
}
