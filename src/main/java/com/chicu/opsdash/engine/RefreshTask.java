package com.chicu.opsdash.engine;

/**
 * Тело периодической задачи.
 * Получает свой handle, чтобы перед применением результата проверить, что задача ещё нужна.
 */
@FunctionalInterface
public interface RefreshTask {

    void run(RefreshHandle handle);
}
