package kz.qazmarka.orch.job;

/** Принимает задания к исполнению. */
public interface JobExecutor {

    /**
     * Ставит задание в очередь; задачи получают идентификаторы {@code task-1..task-N} в порядке команд.
     *
     * @throws IllegalStateException если задание с таким идентификатором уже есть
     */
    void submit(JobSubmission submission);
}
