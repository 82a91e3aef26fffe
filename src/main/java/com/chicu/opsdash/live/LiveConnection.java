package com.chicu.opsdash.live;

/** Открытый поток. close() идемпотентен. */
@FunctionalInterface
public interface LiveConnection {

    void close();
}
