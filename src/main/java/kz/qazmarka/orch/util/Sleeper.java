package kz.qazmarka.orch.util;

import java.util.concurrent.TimeUnit;

/** Абстракция ожидания между попытками и опросами (подменяется в тестах). */
public interface Sleeper {

    Sleeper THREAD = TimeUnit.MILLISECONDS::sleep;

    void sleep(long millis) throws InterruptedException;
}
