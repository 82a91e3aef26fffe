package com.chicu.opsdash.live;

/**
 * Транспорт push-потока событий (SSE).
 * Колбэки могут приходить из чужого потока и в любом порядке после ошибки.
 */
public interface LiveTransport {

    LiveConnection open(String path, Callback callback);

    interface Callback {

        void onOpen();

        /**
         * @param eventName имя SSE-события (init, alert, ...), без имени - "message"
         */
        void onEvent(String eventName, String data);

        void onFailure(Throwable error);

        void onClosed();
    }
}
