package kz.qazmarka.orch.job;

import java.util.List;

/** Опрос и управление запущенным заданием. */
public interface JobOperations {

    /** Текущее состояние всех задач задания (пустой список для неизвестного задания). */
    List<TaskStatus> listTasks(String jobId);

    /** Прерывает незавершённые задачи задания. */
    void terminate(String jobId);
}
